package eu.virtualparadox.regreader.storage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum BlockType {
    @JsonProperty("text") TEXT,
    @JsonProperty("table") TABLE,
    @JsonProperty("heading") HEADING,
    @JsonProperty("list") LIST,
    /** Body text that was printed on the same line as a heading. */
    @JsonProperty("section_content") SECTION_CONTENT
}
