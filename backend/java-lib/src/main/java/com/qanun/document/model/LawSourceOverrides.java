package com.qanun.document.model;

import java.time.LocalDate;

/**
 * Caller-supplied law metadata. Every field is optional; a non-null field
 * takes precedence over the detected value when merged.
 */
public class LawSourceOverrides {
    private final String name;
    private final LawType type;
    private final String jurisdiction;
    private final String issuingAuthority;
    private final LocalDate issueDate;
    private final LocalDate lastUpdate;
    private final String description;
    private final String sourceUrl;

    private LawSourceOverrides(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.jurisdiction = builder.jurisdiction;
        this.issuingAuthority = builder.issuingAuthority;
        this.issueDate = builder.issueDate;
        this.lastUpdate = builder.lastUpdate;
        this.description = builder.description;
        this.sourceUrl = builder.sourceUrl;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static LawSourceOverrides none() {
        return builder().build();
    }

    public String getName() {
        return name;
    }

    public LawType getType() {
        return type;
    }

    public String getJurisdiction() {
        return jurisdiction;
    }

    public String getIssuingAuthority() {
        return issuingAuthority;
    }

    public LocalDate getIssueDate() {
        return issueDate;
    }

    public LocalDate getLastUpdate() {
        return lastUpdate;
    }

    public String getDescription() {
        return description;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    @Override
    public String toString() {
        return String.format("LawSourceOverrides{name='%s', type=%s, jurisdiction='%s', authority='%s'}",
                name, type, jurisdiction, issuingAuthority);
    }

    public static final class Builder {
        private String name;
        private LawType type;
        private String jurisdiction;
        private String issuingAuthority;
        private LocalDate issueDate;
        private LocalDate lastUpdate;
        private String description;
        private String sourceUrl;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(LawType type) {
            this.type = type;
            return this;
        }

        public Builder jurisdiction(String jurisdiction) {
            this.jurisdiction = jurisdiction;
            return this;
        }

        public Builder issuingAuthority(String issuingAuthority) {
            this.issuingAuthority = issuingAuthority;
            return this;
        }

        public Builder issueDate(LocalDate issueDate) {
            this.issueDate = issueDate;
            return this;
        }

        public Builder lastUpdate(LocalDate lastUpdate) {
            this.lastUpdate = lastUpdate;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder sourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
            return this;
        }

        public LawSourceOverrides build() {
            return new LawSourceOverrides(this);
        }
    }
}
