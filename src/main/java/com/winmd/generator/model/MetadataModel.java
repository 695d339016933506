package com.winmd.generator.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The complete declaration graph of one metatext run.
 *
 * Only the collector appends to it; everything handed out is a read-only view.
 * Nothing is ever removed.
 */
public class MetadataModel {
    private MetadataHeader header;
    private final SortedSet<String> importedDlls = new TreeSet<>();
    private final List<FreeFunction> functions = new ArrayList<>();
    private final List<FunctionPointerType> functionPointers = new ArrayList<>();
    private final List<ComInterface> interfaces = new ArrayList<>();
    private final Map<String, Enumeration> enumerationsByName = new LinkedHashMap<>();
    private final List<StructDefinition> structs = new ArrayList<>();
    private final List<GuidConstant> guidConstants = new ArrayList<>();

    public void setHeader(MetadataHeader header) {
        if (this.header != null) {
            throw new IllegalStateException("metadata header is already set");
        }
        this.header = Objects.requireNonNull(header, "header");
    }

    public Optional<MetadataHeader> getHeader() {
        return Optional.ofNullable(header);
    }

    /**
     * Records a DLL for a module extern declaration; names are case-folded.
     */
    public void addImportedDll(String dll) {
        importedDlls.add(dll.toLowerCase(Locale.ROOT));
    }

    public void addFunction(FreeFunction function) {
        functions.add(Objects.requireNonNull(function, "function"));
    }

    public void addFunctionPointer(FunctionPointerType functionPointer) {
        functionPointers.add(Objects.requireNonNull(functionPointer, "functionPointer"));
    }

    public void addInterface(ComInterface comInterface) {
        interfaces.add(Objects.requireNonNull(comInterface, "comInterface"));
    }

    public void addEnumeration(Enumeration enumeration) {
        Objects.requireNonNull(enumeration, "enumeration");
        if (enumerationsByName.containsKey(enumeration.getName())) {
            throw new IllegalStateException("duplicate enum " + enumeration.getName());
        }
        enumerationsByName.put(enumeration.getName(), enumeration);
    }

    public void addStruct(StructDefinition struct) {
        structs.add(Objects.requireNonNull(struct, "struct"));
    }

    public void addGuidConstant(GuidConstant guidConstant) {
        guidConstants.add(Objects.requireNonNull(guidConstant, "guidConstant"));
    }

    public Optional<Enumeration> findEnumeration(String name) {
        return Optional.ofNullable(enumerationsByName.get(name));
    }

    public boolean hasEnumeration(String name) {
        return enumerationsByName.containsKey(name);
    }

    public boolean isFunctionPointerName(String name) {
        return functionPointers.stream().anyMatch(fptr -> fptr.getName().equals(name));
    }

    /**
     * Case-folded DLL names in sorted order.
     */
    public SortedSet<String> getImportedDlls() {
        return Collections.unmodifiableSortedSet(importedDlls);
    }

    public List<FreeFunction> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public List<FunctionPointerType> getFunctionPointers() {
        return Collections.unmodifiableList(functionPointers);
    }

    public List<ComInterface> getInterfaces() {
        return Collections.unmodifiableList(interfaces);
    }

    public Collection<Enumeration> getEnumerations() {
        return Collections.unmodifiableCollection(enumerationsByName.values());
    }

    public List<StructDefinition> getStructs() {
        return Collections.unmodifiableList(structs);
    }

    public List<GuidConstant> getGuidConstants() {
        return Collections.unmodifiableList(guidConstants);
    }
}
