package io.github.notecal.ingestion.domain.model;

public record CandidateFilter(
        String senderAddress,
        String subjectKeyword,
        int maxResults
) {
    public String toSearchQuery() {
        return String.format(
                "(from:%1$s has:attachment is:unread subject:\"%2$s\") OR "
                        + "(from:%1$s is:unread subject:\"%2$s\" -has:attachment)",
                senderAddress, subjectKeyword);
    }
}
