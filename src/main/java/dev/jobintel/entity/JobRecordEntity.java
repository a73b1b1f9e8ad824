package dev.jobintel.entity;

import dev.jobintel.model.CanonicalJobRecord;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * One canonical record inside its (run_date, source) partition.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_records",
        indexes = {
                @Index(name = "idx_partition", columnList = "runDate,source"),
                @Index(name = "idx_job_key", columnList = "jobKey")
        },
        uniqueConstraints = @UniqueConstraint(name = "uk_partition_job", columnNames = {"runDate", "source", "jobKey"}))
public class JobRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String jobKey;

    @Column(nullable = false)
    private LocalDate runDate;

    @Column(nullable = false)
    private String source;

    @Column(nullable = false)
    private String sourceJobId;

    @Column(length = 2048)
    private String jobUrl;

    private String companyName;

    @Column(nullable = false)
    private String companyId;

    private String companyDomain;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    private String department;
    private String employmentType;
    private String seniority;
    private LocalDate datePosted;

    @Column(length = 500)
    private String locationRaw;

    private String city;
    private String state;
    private String postalCode;
    private String msa;
    private boolean remote;

    @Column(nullable = false, length = 2)
    private String country;

    private String roleFamily;

    @Convert(converter = SkillListConverter.class)
    @Column(length = 4000)
    private List<String> skills;

    private String industryTag;

    @Column(nullable = false)
    private Instant scrapedAt;

    public static JobRecordEntity from(CanonicalJobRecord record) {
        return JobRecordEntity.builder()
                .jobKey(record.getJobKey())
                .runDate(record.getRunDate())
                .source(record.getSource())
                .sourceJobId(record.getSourceJobId())
                .jobUrl(record.getJobUrl())
                .companyName(record.getCompanyName())
                .companyId(record.getCompanyId())
                .companyDomain(record.getCompanyDomain())
                .title(record.getTitle())
                .description(record.getDescription())
                .department(record.getDepartment())
                .employmentType(record.getEmploymentType())
                .seniority(record.getSeniority())
                .datePosted(record.getDatePosted())
                .locationRaw(record.getLocationRaw())
                .city(record.getCity())
                .state(record.getState())
                .postalCode(record.getPostalCode())
                .msa(record.getMsa())
                .remote(record.isRemote())
                .country(record.getCountry())
                .roleFamily(record.getRoleFamily())
                .skills(record.getSkills())
                .industryTag(record.getIndustryTag())
                .scrapedAt(record.getScrapedAt())
                .build();
    }

    public CanonicalJobRecord toRecord() {
        return CanonicalJobRecord.builder()
                .jobKey(jobKey)
                .runDate(runDate)
                .source(source)
                .sourceJobId(sourceJobId)
                .jobUrl(jobUrl)
                .companyName(companyName)
                .companyId(companyId)
                .companyDomain(companyDomain)
                .title(title)
                .description(description)
                .department(department)
                .employmentType(employmentType)
                .seniority(seniority)
                .datePosted(datePosted)
                .locationRaw(locationRaw)
                .city(city)
                .state(state)
                .postalCode(postalCode)
                .msa(msa)
                .remote(remote)
                .country(country)
                .roleFamily(roleFamily)
                .skills(skills == null ? List.of() : List.copyOf(skills))
                .industryTag(industryTag)
                .scrapedAt(scrapedAt)
                .build();
    }
}
