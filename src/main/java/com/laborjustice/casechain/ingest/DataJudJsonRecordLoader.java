package com.laborjustice.casechain.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.laborjustice.casechain.exception.RecordLoadException;
import com.laborjustice.casechain.ingest.dto.DataJudAttachment;
import com.laborjustice.casechain.ingest.dto.DataJudMovement;
import com.laborjustice.casechain.ingest.dto.DataJudProcess;
import com.laborjustice.casechain.ingest.dto.DataJudSubject;
import com.laborjustice.casechain.model.record.CaseRecord;
import com.laborjustice.casechain.model.record.MovementEvent;
import com.laborjustice.casechain.model.record.SubjectCode;
import com.laborjustice.casechain.model.record.Tier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads court-registry (DataJud) JSON exports.
 *
 * <p>A file may hold an array of process documents, a single document, or a
 * raw search response ({@code hits.hits[]._source}). A directory is read file
 * by file, {@code *.json} only, in name order.
 *
 * <p>Documents with an unknown {@code grau} are still loaded with a null tier;
 * the reconciliation run reports them as malformed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataJudJsonRecordLoader implements CaseRecordLoader {

    private static final DateTimeFormatter COMPACT_DATE_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private static final List<Function<String, LocalDateTime>> DATE_PARSERS = List.of(
            text -> OffsetDateTime.parse(text).toLocalDateTime(),
            LocalDateTime::parse,
            text -> LocalDate.parse(text).atStartOfDay(),
            text -> LocalDateTime.parse(text, COMPACT_DATE_TIME),
            text -> LocalDate.parse(text, COMPACT_DATE).atStartOfDay());

    private final ObjectMapper objectMapper;

    @Override
    public List<CaseRecord> load(Path source) {
        Preconditions.checkNotNull(source, "Source cannot be null");

        if (!Files.exists(source)) {
            throw new RecordLoadException("Record source does not exist", source);
        }

        if (!Files.isDirectory(source)) {
            return loadFile(source);
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(source)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RecordLoadException("Failed to list record directory", source, e);
        }

        List<CaseRecord> records = new ArrayList<>();
        for (Path file : files) {
            records.addAll(loadFile(file));
        }
        log.info("✅ Loaded {} records from {} files in {}", records.size(), files.size(), source);
        return records;
    }

    private List<CaseRecord> loadFile(Path file) {
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new RecordLoadException("Failed to parse record file", file, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            log.warn("Empty record file: {}", file);
            return List.of();
        }

        List<CaseRecord> records = new ArrayList<>();
        for (JsonNode document : documents(root)) {
            DataJudProcess process;
            try {
                process = objectMapper.treeToValue(document, DataJudProcess.class);
            } catch (JsonProcessingException e) {
                throw new RecordLoadException("Invalid process document", file, e);
            }
            records.add(toRecord(process));
        }
        log.debug("Loaded {} records from {}", records.size(), file);
        return records;
    }

    private static List<JsonNode> documents(JsonNode root) {
        List<JsonNode> documents = new ArrayList<>();
        JsonNode hits = root.path("hits").path("hits");
        if (hits.isArray()) {
            hits.forEach(hit -> documents.add(hit.has("_source") ? hit.get("_source") : hit));
        } else if (root.isArray()) {
            root.forEach(documents::add);
        } else if (root.isObject()) {
            documents.add(root);
        }
        return documents;
    }

    CaseRecord toRecord(DataJudProcess process) {
        CaseRecord.CaseRecordBuilder record = CaseRecord.builder()
                .rawNumber(process.getNumeroProcesso())
                .tier(Tier.fromGradeCode(process.getGrau()).orElse(null))
                .court(process.getTribunal())
                .filedDate(parseDate(process.getDataAjuizamento()))
                .sourceId(process.getId());

        if (process.getAssuntos() != null) {
            for (DataJudSubject subject : process.getAssuntos()) {
                if (subject != null) {
                    record.subjectCode(SubjectCode.of(subject.getCodigo(), subject.getNome()));
                }
            }
        }

        if (process.getMovimentos() != null) {
            for (DataJudMovement movement : process.getMovimentos()) {
                if (movement != null) {
                    record.movement(toEvent(movement));
                }
            }
        }
        return record.build();
    }

    private static MovementEvent toEvent(DataJudMovement movement) {
        MovementEvent.MovementEventBuilder event = MovementEvent.builder()
                .code(movement.getCodigo())
                .name(movement.getNome())
                .timestamp(movement.getDataHora());

        if (movement.getComplementosTabelados() != null) {
            for (DataJudAttachment attachment : movement.getComplementosTabelados()) {
                if (attachment == null) {
                    continue;
                }
                String key = attachment.getDescricao() != null ? attachment.getDescricao() : attachment.getNome();
                String value = attachment.getNome() != null ? attachment.getNome()
                        : attachment.getValor() != null ? String.valueOf(attachment.getValor()) : null;
                if (key != null && value != null) {
                    event.attachment(key, value);
                }
            }
        }
        return event.build();
    }

    /**
     * Accepts ISO date-times with or without offset, plain ISO dates and the
     * compact {@code yyyyMMddHHmmss} form. Anything else yields null.
     */
    static LocalDateTime parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        for (Function<String, LocalDateTime> parser : DATE_PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' rejected: {}", text, e.getMessage());
            }
        }
        log.debug("Unparseable date '{}'", text);
        return null;
    }
}
