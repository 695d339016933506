package com.winmd.generator.integration;

import com.winmd.generator.codegen.GeneratorConfig;
import com.winmd.generator.codegen.GeneratorResult;
import com.winmd.generator.codegen.IlGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the complete metatext to IL generation.
 */
class GeneratorIntegrationTest {

    @TempDir
    Path tempDir;

    @Test
    void testGenerateMinimalFunction() throws IOException {
        Path input = tempDir.resolve("foo.txt");
        Files.writeString(input, """
                meta\tFoo\t1.0
                dll\tfoo.dll
                fn\tDoThing\tHRESULT\t0
                arg\tin\tcount\tUINT32\t0
                """);
        Path output = tempDir.resolve("out/Foo.il");

        GeneratorResult result = new IlGenerator(config(input, output)).generate();

        assertThat(result.isSuccess()).as(result.getErrorMessage()).isTrue();
        assertThat(result.getFunctions()).isEqualTo(1);
        assertThat(result.getImportedDlls()).isEqualTo(1);

        String il = Files.readString(output);
        assertThat(il).contains(".module extern 'foo.dll'");
        assertThat(il).contains(".assembly extern netstandard");
        assertThat(il).contains(".assembly Foo.winmd");
        assertThat(il).contains(".ver 1:0:0:0");
        assertThat(il).contains(".class public auto autochar abstract sealed beforefieldinit Foo.Apis");
        assertThat(il).contains(".method public hidebysig pinvokeimpl(\"foo.dll\" nomangle winapi)");
        assertThat(il).contains("valuetype [Windows.Win32.winmd]Windows.Win32.Foundation.HRESULT DoThing (");
        assertThat(il).contains("[in] uint32 'count'");
        assertThat(il).doesNotContain(".param");
        assertThat(il).doesNotContain(".custom");
    }

    @Test
    void testGenerateInterfaceEnumAndDelegate() throws IOException {
        Path input = tempDir.resolve("archive.txt");
        Files.writeString(tempDir.resolve("enums.txt"), """
                # shared enumerations
                enum\tAskMode\tINT32
                variant\tkExtract\t0
                variant\tkTest\t1
                """);
        Files.writeString(input, """
                meta\tSevenZip\t1.0
                include\tenums.txt
                fptr\tProgressCallback\tHRESULT\t0
                arg\tin\tcompleted\tUINT64\t0
                iface\tIArchiveExtractCallback\t5\t9\tIUnknown
                meth\tPrepareOperation\tHRESULT\t0
                arg\tin\taskExtractMode\tAskMode\t0
                meth\tGetNames\tHRESULT\t0
                arg\tout\tnames\tPWSTR\t1\tcom_out cc4
                """);
        Path output = tempDir.resolve("SevenZip.il");

        GeneratorResult result = new IlGenerator(config(input, output)).generate();

        assertThat(result.isSuccess()).as(result.getErrorMessage()).isTrue();
        assertThat(result.getInterfaces()).isEqualTo(1);
        assertThat(result.getEnumerations()).isEqualTo(1);
        assertThat(result.getFunctionPointers()).isEqualTo(1);

        String il = Files.readString(output);
        assertThat(il).contains(".class public auto autochar sealed beforefieldinit SevenZip.ProgressCallback");
        assertThat(il).contains("instance valuetype [Windows.Win32.winmd]Windows.Win32.Foundation.HRESULT Invoke (");
        assertThat(il).contains(".class interface public abstract auto ansi SevenZip.IArchiveExtractCallback");
        assertThat(il).contains("implements [Windows.Win32.winmd]Windows.Win32.System.Com.IUnknown");
        assertThat(il).contains("01 00 69 0F 17 23 C1 40 8A 27 00 00 00 05 00 09 00 00 00 00");
        assertThat(il).contains("[in] int32 'askExtractMode'");
        assertThat(il).contains("AssociatedEnumAttribute::.ctor(string)");
        assertThat(il).contains("01 00 07 41 73 6B 4D 6F 64 65 00 00 // AskMode");
        assertThat(il).contains("[out] valuetype [Windows.Win32.winmd]Windows.Win32.Foundation.PWSTR* 'names'");
        assertThat(il).contains("ComOutPtrAttribute::.ctor()");
        assertThat(il).contains("01 00 01 00 53 08 0A 43 6F 75 6E 74 43 6F 6E 73 74 04 00 00 00");
        assertThat(il).contains(".field public specialname rtspecialname int32 value__");
        assertThat(il).contains(".field public static literal valuetype SevenZip.AskMode kTest = int32(1)");
        assertThat(il).doesNotContain("SevenZip.Apis");
    }

    @Test
    void testParamIndexIsOneBased() throws IOException {
        Path input = tempDir.resolve("foo.txt");
        Files.writeString(input, """
                meta\tFoo\t1.0
                dll\tfoo.dll
                fn\tRead\tBOOL\t0
                arg\tin\tcount\tUINT32\t0
                arg\tout\tbuffer\tBYTE\t1\tca0
                """);
        Path output = tempDir.resolve("Foo.il");

        GeneratorResult result = new IlGenerator(config(input, output)).generate();

        assertThat(result.isSuccess()).as(result.getErrorMessage()).isTrue();
        String il = Files.readString(output);
        assertThat(il).contains(".param [2]");
        assertThat(il).doesNotContain(".param [1]");
        assertThat(il).contains("NativeArrayInfoAttribute::.ctor()");
    }

    @Test
    void testFailureLeavesExistingOutputUntouched() throws IOException {
        Path input = tempDir.resolve("broken.txt");
        Files.writeString(input, """
                meta\tFoo\t1.0
                fn\tDoThing\tUINT32\t0
                """);
        Path output = tempDir.resolve("Foo.il");
        Files.writeString(output, "previous");

        GeneratorResult result = new IlGenerator(config(input, output)).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage())
                .isEqualTo("broken.txt:2: \"fn\" entry without a previous \"dll\" entry");
        assertThat(Files.readString(output)).isEqualTo("previous");
        try (var files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactlyInAnyOrder("broken.txt", "Foo.il");
        }
    }

    @Test
    void testEmptyInputHasNothingToRender() throws IOException {
        Path input = tempDir.resolve("empty.txt");
        Files.writeString(input, "# nothing here\n");
        Path output = tempDir.resolve("Empty.il");

        GeneratorResult result = new IlGenerator(config(input, output)).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("meta");
        assertThat(output).doesNotExist();
    }

    @Test
    void testMissingInputIsReported() {
        Path output = tempDir.resolve("Foo.il");

        GeneratorResult result = new IlGenerator(config(tempDir.resolve("missing.txt"), output)).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage())
                .startsWith("missing.txt: cannot read ")
                .endsWith("file not found");
        assertThat(output).doesNotExist();
    }

    private static GeneratorConfig config(Path input, Path output) {
        return GeneratorConfig.builder()
                .inputPath(input)
                .outputPath(output)
                .build();
    }
}
