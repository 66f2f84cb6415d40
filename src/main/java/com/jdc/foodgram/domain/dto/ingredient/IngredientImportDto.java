package com.jdc.foodgram.domain.dto.ingredient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 재료 일괄 등록 파일의 한 줄. JSON 형식은 {"name": ..., "measurement_unit": ...}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IngredientImportDto {
    private String name;
    @JsonProperty("measurement_unit")
    private String measurementUnit;
}
