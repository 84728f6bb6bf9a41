package com.example.flowerclassifier.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Growth stage of a tomato flower. The numeric index is the wire encoding and
 * matches the class index emitted by the detection model.
 */
public enum Stage {

    BUD(0, "bud"),
    ANTHESIS(1, "anthesis"),
    POST_ANTHESIS(2, "post-anthesis");

    private final int index;
    private final String label;

    Stage(int index, String label) {
        this.index = index;
        this.label = label;
    }

    @JsonValue
    public int index() {
        return index;
    }

    public String label() {
        return label;
    }

    public static Stage fromIndex(int index) {
        for (Stage stage : values()) {
            if (stage.index == index) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown flower stage index: " + index);
    }
}
