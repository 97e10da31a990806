package org.example.bookmarksync.karakeep;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KarakeepBookmark(
    String id,
    Instant createdAt,
    Instant modifiedAt,
    String title,
    boolean archived,
    boolean favourited,
    String taggingStatus,
    String note,
    String summary,
    List<Tag> tags,
    KarakeepBookmarkContent content
) {
    public KarakeepBookmark {
        tags = tags == null ? List.of() : tags;
        content = content == null ? KarakeepBookmarkContent.unknown() : content;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Tag(
        String id,
        String name,
        String attachedBy
    ) {}

    /**
     * The modification reference used for update decisions: {@code modifiedAt} when the
     * source reports one, otherwise {@code createdAt}.
     */
    public Instant effectiveModifiedAt() {
        return modifiedAt != null ? modifiedAt : createdAt;
    }

    public boolean hasTag(String name) {
        for (Tag tag : tags) {
            if (tag.name() != null && tag.name().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    public List<String> tagNames() {
        return tags.stream()
            .map(Tag::name)
            .filter(name -> name != null && !name.isBlank())
            .toList();
    }
}
