package com.dochunker.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * 출력 단위(청크). JSONL 한 줄 = Passage 하나.
 * id = sha1(url + "\n" + text) 앞 16자리 → 같은 (url, text)면 재실행해도 같은 id.
 */
@JsonPropertyOrder({"id", "text", "metadata"})
public final class Passage {

    /** 출처 메타데이터 */
    @JsonPropertyOrder({"source", "url", "title", "section_path"})
    public static final class Metadata {
        private final String source;
        private final String url;
        private final String title;
        private final String sectionPath;

        public Metadata(String source, String url, String title, String sectionPath) {
            this.source = source;
            this.url = url;
            this.title = title;
            this.sectionPath = sectionPath;
        }

        @JsonProperty("source") public String getSource() { return source; }
        @JsonProperty("url") public String getUrl() { return url; }
        @JsonProperty("title") public String getTitle() { return title; }
        @JsonProperty("section_path") public String getSectionPath() { return sectionPath; }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Metadata)) return false;
            Metadata m = (Metadata) o;
            return Objects.equals(source, m.source) && Objects.equals(url, m.url)
                    && Objects.equals(title, m.title) && Objects.equals(sectionPath, m.sectionPath);
        }
        @Override public int hashCode() { return Objects.hash(source, url, title, sectionPath); }
    }

    private final String id;
    private final String text;
    private final Metadata metadata;

    public Passage(String id, String text, Metadata metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.text = Objects.requireNonNull(text, "text");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    @JsonProperty("id") public String getId() { return id; }
    @JsonProperty("text") public String getText() { return text; }
    @JsonProperty("metadata") public Metadata getMetadata() { return metadata; }

    @Override public String toString() {
        return "Passage{id=" + id + ", chars=" + text.length() + ", path=" + metadata.getSectionPath() + "}";
    }
}
