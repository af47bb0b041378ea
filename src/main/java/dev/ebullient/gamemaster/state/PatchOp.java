package dev.ebullient.gamemaster.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One tagged operation of a patch. Paths are dot-paths rooted at a top-level domain.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "op")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PatchOp.Assign.class, name = "set"),
        @JsonSubTypes.Type(value = PatchOp.Delete.class, name = "delete"),
        @JsonSubTypes.Type(value = PatchOp.Append.class, name = "append")
})
public interface PatchOp {

    String path();

    /**
     * Set a leaf value. Object values merge into an existing object without
     * touching sibling keys; every other value replaces the leaf.
     */
    record Assign(String path, Object value) implements PatchOp {
    }

    /** Remove the key entirely from its parent. */
    record Delete(String path) implements PatchOp {
    }

    /** Append each item, in order, to the list at {@code path}. */
    record Append(String path, List<Object> items) implements PatchOp {
        public Append {
            items = items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
        }
    }
}
