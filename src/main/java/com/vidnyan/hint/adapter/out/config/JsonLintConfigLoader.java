package com.vidnyan.hint.adapter.out.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.hint.domain.lint.LintConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reads lint options from a JSON file.
 * Settings present in the file override the base configuration; absent ones keep its values.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonLintConfigLoader {

    private final ObjectMapper objectMapper;

    public LintConfig load(Path file, LintConfig base) throws IOException {
        ConfigDto dto;
        try (InputStream in = Files.newInputStream(file)) {
            dto = objectMapper.readValue(in, ConfigDto.class);
        }
        LintConfig config = overlay(dto, base);
        log.info("Loaded lint configuration from {}", file);
        return config;
    }

    private LintConfig overlay(ConfigDto dto, LintConfig base) {
        LintConfig.LintConfigBuilder b = base.toBuilder();
        if (dto.minConfidence != null) b.minConfidence(dto.minConfidence);
        if (dto.packageComments != null) b.packageComments(dto.packageComments);
        if (dto.imports != null) b.imports(dto.imports);
        if (dto.exported != null) b.exported(dto.exported);
        if (dto.allowPackagePrefixInNames != null) b.allowPackagePrefixInNames(dto.allowPackagePrefixInNames);
        if (dto.naming != null) b.naming(dto.naming);
        if (dto.flagUnderscoreInPackageName != null) b.flagUnderscoreInPackageName(dto.flagUnderscoreInPackageName);
        if (dto.varDecls != null) b.varDecls(dto.varDecls);
        if (dto.elses != null) b.elses(dto.elses);
        if (dto.rangeLoops != null) b.rangeLoops(dto.rangeLoops);
        if (dto.errorChecks != null) b.errorChecks(dto.errorChecks);
        if (dto.receiverNames != null) b.receiverNames(dto.receiverNames);
        if (dto.incDec != null) b.incDec(dto.incDec);
        if (dto.makeSlice != null) b.makeSlice(dto.makeSlice);
        if (dto.errorReturn != null) b.errorReturn(dto.errorReturn);
        if (dto.ignoredReturn != null) b.ignoredReturn(dto.ignoredReturn);
        if (dto.namedReturn != null) b.namedReturn(dto.namedReturn);
        if (dto.useFixedReceiverName != null) b.useFixedReceiverName(dto.useFixedReceiverName);
        if (dto.fixedReceiverName != null) b.fixedReceiverName(dto.fixedReceiverName);
        if (dto.disallowedReceiverNames != null) {
            b.disallowedReceiverNames(new LinkedHashSet<>(dto.disallowedReceiverNames));
        }
        if (dto.initialisms != null) b.initialisms(new LinkedHashSet<>(dto.initialisms));
        return b.build();
    }

    // DTO class for JSON deserialization
    static class ConfigDto {
        public Double minConfidence;
        public Boolean packageComments;
        public Boolean imports;
        public Boolean exported;
        public Boolean allowPackagePrefixInNames;
        public Boolean naming;
        public Boolean flagUnderscoreInPackageName;
        public Boolean varDecls;
        public Boolean elses;
        public Boolean rangeLoops;
        public Boolean errorChecks;
        public Boolean receiverNames;
        public Boolean incDec;
        public Boolean makeSlice;
        public Boolean errorReturn;
        public Boolean ignoredReturn;
        public Boolean namedReturn;
        public Boolean useFixedReceiverName;
        public String fixedReceiverName;
        public List<String> disallowedReceiverNames;
        public List<String> initialisms;
    }
}
