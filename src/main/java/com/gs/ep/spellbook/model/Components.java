package com.gs.ep.spellbook.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Verbal, somatic and material components needed to cast a spell.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Components {

    private final boolean verbal;
    private final boolean somatic;
    private final String material;

    /**
     * @param material description of the material components, or null when none are needed
     */
    @JsonCreator
    public Components(@JsonProperty("verbal") boolean verbal, @JsonProperty("somatic") boolean somatic,
            @JsonProperty("material") String material) {
        this.verbal = verbal;
        this.somatic = somatic;
        this.material = material;
    }

    public boolean isVerbal() {
        return verbal;
    }

    public boolean isSomatic() {
        return somatic;
    }

    public String getMaterial() {
        return material;
    }

    /**
     * "V, S, M (a bit of fleece)"
     */
    public String asText() {
        StringBuilder sb = new StringBuilder();
        if (verbal) {
            sb.append('V');
        }
        if (somatic) {
            sb.append(sb.length() > 0 ? ", " : "").append('S');
        }
        if (material != null) {
            sb.append(sb.length() > 0 ? ", " : "").append("M (").append(material).append(')');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Components)) {
            return false;
        }
        Components other = (Components) o;
        return verbal == other.verbal && somatic == other.somatic && Objects.equals(material, other.material);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verbal, somatic, material);
    }
}
