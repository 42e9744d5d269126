package com.example.transtructiver.data;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One corpus entry. Ids come from either an {@code id} or an {@code index} field.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Sample {
    @JsonAlias("index")
    private String id;
    private String code;
    private String language;

    @Override
    public String toString() {
        return "Sample[" + id + ", " + language + "]";
    }
}
