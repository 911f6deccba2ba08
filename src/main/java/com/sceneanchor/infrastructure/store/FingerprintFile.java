package com.sceneanchor.infrastructure.store;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * On-disk shape of the fingerprint file. Aliases accept files written with the older
 * field names; they never reach the domain model.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"documentChecksum", "generatedAt", "spans"})
public record FingerprintFile(
        @JsonAlias("manuscript_sha") String documentChecksum,
        @JsonAlias("generated_at") String generatedAt,
        @JsonAlias("scenes") Map<String, Entry> spans
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"id", "sha", "offset", "len", "pre", "post", "rareShingles", "text"})
    public record Entry(
            String id,
            String sha,
            Integer offset,
            @JsonAlias("length") Integer len,
            @JsonAlias("preContext") String pre,
            @JsonAlias("postContext") String post,
            List<String> rareShingles,
            String text
    ) {}
}
