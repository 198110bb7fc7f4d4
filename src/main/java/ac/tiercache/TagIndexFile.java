package ac.tiercache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * On-disk reverse index: the keys currently carrying one tag.
 */
public class TagIndexFile {
    private final String tag;
    private final List<String> keys;

    @JsonCreator
    public TagIndexFile(
            @JsonProperty("tag") String tag,
            @JsonProperty("keys") List<String> keys) {
        this.tag = tag;
        this.keys = keys != null ? List.copyOf(keys) : List.of();
    }

    public String getTag() {
        return tag;
    }

    public List<String> getKeys() {
        return keys;
    }
}
