package dev.jobintel.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobintel.config.PipelineProperties;
import dev.jobintel.model.RawJobPosting;
import dev.jobintel.service.JobKeyHasher;
import dev.jobintel.source.PostingSource;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads connector dumps from {@code {rawDir}/{runDate}/**.json}.
 *
 * <p>Each file is an envelope holding the postings of one company on one source:
 * <pre>
 * {"source": "greenhouse", "companyName": "Acme", "companyId": "...",
 *  "extractedAt": "2024-05-01T12:00:00Z", "postings": [ ... ]}
 * </pre>
 * Envelope values fill posting fields the connector left empty. Files that cannot be
 * parsed are logged and skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RawFilePostingSource implements PostingSource {

    private final PipelineProperties pipelineProperties;
    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return "raw-files";
    }

    @Override
    public Flux<RawJobPosting> fetchPostings(LocalDate runDate) {
        Path dir = Paths.get(pipelineProperties.getRawDir()).resolve(runDate.toString());
        if (!Files.isDirectory(dir)) {
            log.warn("No raw dumps for {} under {}", runDate, dir.toAbsolutePath());
            return Flux.empty();
        }

        return Flux.defer(() -> Flux.fromIterable(listDumpFiles(dir)))
                .concatMapIterable(this::readDump)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private List<Path> listDumpFiles(Path dir) {
        try (Stream<Path> files = Files.walk(dir)) {
            List<Path> dumps = files
                    .filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
            log.info("Found {} raw dump files under {}", dumps.size(), dir);
            return dumps;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list raw dumps under " + dir, e);
        }
    }

    List<RawJobPosting> readDump(Path file) {
        DumpEnvelope envelope;
        try {
            envelope = objectMapper.readValue(file.toFile(), DumpEnvelope.class);
        } catch (IOException e) {
            log.warn("Skipping unreadable dump {}: {}", file, e.getMessage());
            return List.of();
        }
        if (envelope == null || envelope.getPostings() == null) {
            log.warn("Skipping dump without postings: {}", file);
            return List.of();
        }

        List<RawJobPosting> postings = envelope.getPostings().stream()
                .map(posting -> toPosting(envelope, posting))
                .toList();
        log.debug("Read {} postings from {}", postings.size(), file);
        return postings;
    }

    private RawJobPosting toPosting(DumpEnvelope envelope, DumpPosting posting) {
        String companyName = firstNonBlank(posting.getCompanyName(), envelope.getCompanyName());
        String companyDomain = firstNonBlank(posting.getCompanyDomain(), envelope.getCompanyDomain());
        String companyId = firstNonBlank(posting.getCompanyId(), envelope.getCompanyId());
        if (companyId == null && companyName != null && !companyName.isBlank()) {
            companyId = JobKeyHasher.companyId(companyName, companyDomain);
        }

        return RawJobPosting.builder()
                .source(firstNonBlank(posting.getSource(), envelope.getSource()))
                .sourceJobId(posting.getSourceJobId())
                .title(posting.getTitle())
                .description(posting.getDescription())
                .locationRaw(posting.getLocationRaw())
                .department(posting.getDepartment())
                .employmentType(posting.getEmploymentType())
                .datePosted(posting.getDatePosted())
                .companyName(companyName)
                .companyId(companyId)
                .companyDomain(companyDomain)
                .jobUrl(posting.getJobUrl())
                .fetchedAt(posting.getFetchedAt() != null ? posting.getFetchedAt() : envelope.getExtractedAt())
                .build();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return fallback != null && !fallback.isBlank() ? fallback : null;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DumpEnvelope {
        private String source;
        private String companyName;
        private String companyId;
        private String companyDomain;
        private Instant extractedAt;
        private List<DumpPosting> postings;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DumpPosting {
        private String source;
        private String sourceJobId;
        private String title;
        private String description;
        private String locationRaw;
        private String department;
        private String employmentType;
        private LocalDate datePosted;
        private String companyName;
        private String companyId;
        private String companyDomain;
        private String jobUrl;
        private Instant fetchedAt;
    }
}
