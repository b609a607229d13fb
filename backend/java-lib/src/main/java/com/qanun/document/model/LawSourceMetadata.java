package com.qanun.document.model;

import java.time.LocalDate;

/**
 * Metadata describing the legal instrument a document represents.
 * Name, type and jurisdiction always carry a value; the defaults apply
 * when nothing was detected or provided.
 */
public class LawSourceMetadata {
    public static final String DEFAULT_NAME = "وثيقة قانونية";
    public static final LawType DEFAULT_TYPE = LawType.LAW;
    public static final String DEFAULT_JURISDICTION = "المملكة العربية السعودية";

    private final String name;
    private final LawType type;
    private final String jurisdiction;
    private final String issuingAuthority;
    private final LocalDate issueDate;
    private final LocalDate lastUpdate;
    private final String description;
    private final String sourceUrl;

    // Defaults only
    public LawSourceMetadata() {
        this(null, null, null, null, null, null, null, null);
    }

    public LawSourceMetadata(String name, LawType type, String jurisdiction, String issuingAuthority,
            LocalDate issueDate, LocalDate lastUpdate, String description, String sourceUrl) {
        this.name = name != null ? name : DEFAULT_NAME;
        this.type = type != null ? type : DEFAULT_TYPE;
        this.jurisdiction = jurisdiction != null ? jurisdiction : DEFAULT_JURISDICTION;
        this.issuingAuthority = issuingAuthority;
        this.issueDate = issueDate;
        this.lastUpdate = lastUpdate;
        this.description = description;
        this.sourceUrl = sourceUrl;
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

    public boolean hasIssuingAuthority() {
        return issuingAuthority != null;
    }

    public boolean hasIssueDate() {
        return issueDate != null;
    }

    @Override
    public String toString() {
        return String.format("LawSourceMetadata{name='%s', type=%s, jurisdiction='%s', authority='%s', issueDate=%s}",
                name, type.getValue(), jurisdiction, issuingAuthority, issueDate);
    }
}
