package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A detection rule normalized from one of the vendor repositories.
 *
 * Records are produced by the ingestion side and are read-only here: every
 * collection is unmodifiable and a changed rule arrives as a new instance in a
 * new snapshot. Set-valued fields keep their authored order for display but
 * are compared as sets.
 */
@JsonDeserialize(builder = DetectionRecord.Builder.class)
public final class DetectionRecord {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("source")
    private final DetectionSource source;

    @JsonProperty("language")
    private final String language;

    @JsonProperty("title")
    private final String title;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("severity")
    private final Severity severity;

    @JsonProperty("status")
    private final RuleStatus status;

    @JsonProperty("detection_logic")
    private final String detectionLogic;

    @JsonProperty("raw_content")
    private final String rawContent;

    @JsonProperty("author")
    private final String author;

    @JsonProperty("rule_id")
    private final String ruleId;

    @JsonProperty("rule_created_date")
    private final Instant ruleCreatedDate;

    @JsonProperty("rule_modified_date")
    private final Instant ruleModifiedDate;

    @JsonProperty("tags")
    private final Set<String> tags;

    @JsonProperty("mitre_tactics")
    private final Set<String> mitreTactics;

    @JsonProperty("mitre_techniques")
    private final Set<String> mitreTechniques;

    @JsonProperty("log_sources")
    private final Set<String> logSources;

    @JsonProperty("platform")
    private final String platform;

    @JsonProperty("event_category")
    private final String eventCategory;

    @JsonProperty("data_source_normalized")
    private final String dataSourceNormalized;

    @JsonProperty("references")
    private final List<String> references;

    @JsonProperty("false_positives")
    private final List<String> falsePositives;

    @JsonProperty("source_rule_url")
    private final String sourceRuleUrl;

    @JsonProperty("source_file")
    private final String sourceFile;

    @JsonProperty("updated_at")
    private final Instant updatedAt;

    private DetectionRecord(Builder builder) {
        this.id = builder.id;
        this.source = builder.source;
        this.language = builder.language;
        this.title = builder.title;
        this.description = builder.description;
        this.severity = builder.severity;
        this.status = builder.status;
        this.detectionLogic = builder.detectionLogic;
        this.rawContent = builder.rawContent;
        this.author = builder.author;
        this.ruleId = builder.ruleId;
        this.ruleCreatedDate = builder.ruleCreatedDate;
        this.ruleModifiedDate = builder.ruleModifiedDate;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.mitreTactics = Collections.unmodifiableSet(new LinkedHashSet<>(builder.mitreTactics));
        this.mitreTechniques = Collections.unmodifiableSet(new LinkedHashSet<>(builder.mitreTechniques));
        this.logSources = Collections.unmodifiableSet(new LinkedHashSet<>(builder.logSources));
        this.platform = builder.platform;
        this.eventCategory = builder.eventCategory;
        this.dataSourceNormalized = builder.dataSourceNormalized;
        this.references = Collections.unmodifiableList(new ArrayList<>(builder.references));
        this.falsePositives = Collections.unmodifiableList(new ArrayList<>(builder.falsePositives));
        this.sourceRuleUrl = builder.sourceRuleUrl;
        this.sourceFile = builder.sourceFile;
        this.updatedAt = builder.updatedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start a builder pre-populated with this record's values.
     */
    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .source(source)
            .language(language)
            .title(title)
            .description(description)
            .severity(severity)
            .status(status)
            .detectionLogic(detectionLogic)
            .rawContent(rawContent)
            .author(author)
            .ruleId(ruleId)
            .ruleCreatedDate(ruleCreatedDate)
            .ruleModifiedDate(ruleModifiedDate)
            .tags(tags)
            .mitreTactics(mitreTactics)
            .mitreTechniques(mitreTechniques)
            .logSources(logSources)
            .platform(platform)
            .eventCategory(eventCategory)
            .dataSourceNormalized(dataSourceNormalized)
            .references(references)
            .falsePositives(falsePositives)
            .sourceRuleUrl(sourceRuleUrl)
            .sourceFile(sourceFile)
            .updatedAt(updatedAt);
    }

    // Getters

    public String getId() {
        return id;
    }

    public DetectionSource getSource() {
        return source;
    }

    public String getLanguage() {
        return language;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public RuleStatus getStatus() {
        return status;
    }

    public String getDetectionLogic() {
        return detectionLogic;
    }

    public String getRawContent() {
        return rawContent;
    }

    public String getAuthor() {
        return author;
    }

    public String getRuleId() {
        return ruleId;
    }

    public Instant getRuleCreatedDate() {
        return ruleCreatedDate;
    }

    public Instant getRuleModifiedDate() {
        return ruleModifiedDate;
    }

    public Set<String> getTags() {
        return tags;
    }

    public Set<String> getMitreTactics() {
        return mitreTactics;
    }

    public Set<String> getMitreTechniques() {
        return mitreTechniques;
    }

    public Set<String> getLogSources() {
        return logSources;
    }

    public String getPlatform() {
        return platform;
    }

    public String getEventCategory() {
        return eventCategory;
    }

    public String getDataSourceNormalized() {
        return dataSourceNormalized;
    }

    public List<String> getReferences() {
        return references;
    }

    public List<String> getFalsePositives() {
        return falsePositives;
    }

    public String getSourceRuleUrl() {
        return sourceRuleUrl;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DetectionRecord)) {
            return false;
        }
        DetectionRecord that = (DetectionRecord) o;
        return Objects.equals(id, that.id)
            && source == that.source
            && Objects.equals(language, that.language)
            && Objects.equals(title, that.title)
            && Objects.equals(description, that.description)
            && severity == that.severity
            && status == that.status
            && Objects.equals(detectionLogic, that.detectionLogic)
            && Objects.equals(rawContent, that.rawContent)
            && Objects.equals(author, that.author)
            && Objects.equals(ruleId, that.ruleId)
            && Objects.equals(ruleCreatedDate, that.ruleCreatedDate)
            && Objects.equals(ruleModifiedDate, that.ruleModifiedDate)
            && tags.equals(that.tags)
            && mitreTactics.equals(that.mitreTactics)
            && mitreTechniques.equals(that.mitreTechniques)
            && logSources.equals(that.logSources)
            && Objects.equals(platform, that.platform)
            && Objects.equals(eventCategory, that.eventCategory)
            && Objects.equals(dataSourceNormalized, that.dataSourceNormalized)
            && references.equals(that.references)
            && falsePositives.equals(that.falsePositives)
            && Objects.equals(sourceRuleUrl, that.sourceRuleUrl)
            && Objects.equals(sourceFile, that.sourceFile)
            && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, source, title, severity, status, mitreTechniques);
    }

    @Override
    public String toString() {
        String shortTitle = title != null && title.length() > 50 ? title.substring(0, 50) : title;
        return "DetectionRecord{id=" + id + ", source=" + source + ", title=" + shortTitle + "}";
    }

    /**
     * Builder for {@link DetectionRecord}; also the Jackson deserialization entry point.
     * Missing collections become empty, missing severity and status become unknown.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {

        private String id;
        private DetectionSource source = DetectionSource.OTHER;
        private String language = "unknown";
        private String title;
        private String description;
        private Severity severity = Severity.UNKNOWN;
        private RuleStatus status = RuleStatus.UNKNOWN;
        private String detectionLogic;
        private String rawContent;
        private String author;
        private String ruleId;
        private Instant ruleCreatedDate;
        private Instant ruleModifiedDate;
        private Collection<String> tags = Collections.emptyList();
        private Collection<String> mitreTactics = Collections.emptyList();
        private Collection<String> mitreTechniques = Collections.emptyList();
        private Collection<String> logSources = Collections.emptyList();
        private String platform = "";
        private String eventCategory = "";
        private String dataSourceNormalized = "";
        private Collection<String> references = Collections.emptyList();
        private Collection<String> falsePositives = Collections.emptyList();
        private String sourceRuleUrl;
        private String sourceFile;
        private Instant updatedAt;

        private Builder() {
        }

        @JsonProperty("id")
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        @JsonProperty("source")
        public Builder source(DetectionSource source) {
            this.source = source != null ? source : DetectionSource.OTHER;
            return this;
        }

        @JsonProperty("language")
        public Builder language(String language) {
            this.language = language != null ? language : "unknown";
            return this;
        }

        @JsonProperty("title")
        public Builder title(String title) {
            this.title = title;
            return this;
        }

        @JsonProperty("description")
        public Builder description(String description) {
            this.description = description;
            return this;
        }

        @JsonProperty("severity")
        public Builder severity(Severity severity) {
            this.severity = severity != null ? severity : Severity.UNKNOWN;
            return this;
        }

        @JsonProperty("status")
        public Builder status(RuleStatus status) {
            this.status = status != null ? status : RuleStatus.UNKNOWN;
            return this;
        }

        @JsonProperty("detection_logic")
        public Builder detectionLogic(String detectionLogic) {
            this.detectionLogic = detectionLogic;
            return this;
        }

        @JsonProperty("raw_content")
        public Builder rawContent(String rawContent) {
            this.rawContent = rawContent;
            return this;
        }

        @JsonProperty("author")
        public Builder author(String author) {
            this.author = author;
            return this;
        }

        @JsonProperty("rule_id")
        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        @JsonProperty("rule_created_date")
        public Builder ruleCreatedDate(Instant ruleCreatedDate) {
            this.ruleCreatedDate = ruleCreatedDate;
            return this;
        }

        @JsonProperty("rule_modified_date")
        public Builder ruleModifiedDate(Instant ruleModifiedDate) {
            this.ruleModifiedDate = ruleModifiedDate;
            return this;
        }

        @JsonProperty("tags")
        public Builder tags(Collection<String> tags) {
            this.tags = orEmpty(tags);
            return this;
        }

        @JsonProperty("mitre_tactics")
        public Builder mitreTactics(Collection<String> mitreTactics) {
            this.mitreTactics = orEmpty(mitreTactics);
            return this;
        }

        @JsonProperty("mitre_techniques")
        public Builder mitreTechniques(Collection<String> mitreTechniques) {
            this.mitreTechniques = orEmpty(mitreTechniques);
            return this;
        }

        @JsonProperty("log_sources")
        public Builder logSources(Collection<String> logSources) {
            this.logSources = orEmpty(logSources);
            return this;
        }

        @JsonProperty("platform")
        public Builder platform(String platform) {
            this.platform = platform != null ? platform : "";
            return this;
        }

        @JsonProperty("event_category")
        public Builder eventCategory(String eventCategory) {
            this.eventCategory = eventCategory != null ? eventCategory : "";
            return this;
        }

        @JsonProperty("data_source_normalized")
        public Builder dataSourceNormalized(String dataSourceNormalized) {
            this.dataSourceNormalized = dataSourceNormalized != null ? dataSourceNormalized : "";
            return this;
        }

        @JsonProperty("references")
        public Builder references(Collection<String> references) {
            this.references = orEmpty(references);
            return this;
        }

        @JsonProperty("false_positives")
        public Builder falsePositives(Collection<String> falsePositives) {
            this.falsePositives = orEmpty(falsePositives);
            return this;
        }

        @JsonProperty("source_rule_url")
        public Builder sourceRuleUrl(String sourceRuleUrl) {
            this.sourceRuleUrl = sourceRuleUrl;
            return this;
        }

        @JsonProperty("source_file")
        public Builder sourceFile(String sourceFile) {
            this.sourceFile = sourceFile;
            return this;
        }

        @JsonProperty("updated_at")
        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        /**
         * @throws IllegalStateException if the record has no id
         */
        public DetectionRecord build() {
            if (id == null || id.trim().isEmpty()) {
                throw new IllegalStateException("Detection record id must not be null or empty");
            }
            return new DetectionRecord(this);
        }

        private static Collection<String> orEmpty(Collection<String> values) {
            if (values == null) {
                return Collections.emptyList();
            }
            List<String> cleaned = new ArrayList<>(values.size());
            for (String value : values) {
                if (value != null && !value.isEmpty()) {
                    cleaned.add(value);
                }
            }
            return cleaned;
        }
    }
}
