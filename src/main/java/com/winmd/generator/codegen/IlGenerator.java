package com.winmd.generator.codegen;

import com.winmd.generator.codegen.render.IlDocument;
import com.winmd.generator.codegen.render.IlDocumentBuilder;
import com.winmd.generator.codegen.render.RenderException;
import com.winmd.generator.codegen.util.FileWriteUtil;
import com.winmd.generator.model.MetadataModel;
import com.winmd.generator.parser.MetatextCollector;
import com.winmd.generator.parser.exception.DefinitionException;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

/**
 * Compiles a metatext definition file into ILAsm source.
 *
 * The whole document is rendered in memory before anything is written, so a failed
 * run leaves no output file behind.
 */
public class IlGenerator {
    private static final Logger log = LoggerFactory.getLogger(IlGenerator.class);

    private final GeneratorConfig config;
    private final Configuration freemarkerConfig;

    public IlGenerator(GeneratorConfig config) {
        this.config = config;
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public GeneratorResult generate() {
        try {
            log.info("Starting IL generation...");

            log.info("Step 1: Collecting definitions from {}", config.getInputPath());
            MetadataModel model = new MetatextCollector().collectPath(config.getInputPath());

            log.info("Step 2: Rendering IL...");
            String il = render(model);

            log.info("Step 3: Writing {}", config.getOutputPath());
            FileWriteUtil.writeAtomically(config.getOutputPath(), il);

            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(config.getOutputPath())
                    .importedDlls(model.getImportedDlls().size())
                    .functions(model.getFunctions().size())
                    .functionPointers(model.getFunctionPointers().size())
                    .interfaces(model.getInterfaces().size())
                    .enumerations(model.getEnumerations().size())
                    .structs(model.getStructs().size())
                    .guidConstants(model.getGuidConstants().size())
                    .build();

        } catch (DefinitionException e) {
            log.debug("Definition error", e);
            return GeneratorResult.failure(e.getMessage());
        } catch (RenderException e) {
            log.debug("Render error", e);
            return GeneratorResult.failure("failed to render IL: " + e.getMessage());
        } catch (IOException e) {
            log.debug("I/O error", e);
            return GeneratorResult.failure("I/O error: " + e.getMessage());
        }
    }

    /**
     * Renders a collected model to IL text.
     *
     * @throws RenderException if the model cannot be resolved or the template fails
     */
    public String render(MetadataModel model) {
        IlDocument document = new IlDocumentBuilder(model).build();
        try {
            Template template = freemarkerConfig.getTemplate(config.getTemplateName());
            StringWriter out = new StringWriter();
            template.process(Map.of("document", document), out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new RenderException("template '" + config.getTemplateName() + "' failed: " + e.getMessage(), e);
        }
    }
}
