package com.infomedia.abacox.callshipping.dto.configuration;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * New values for keys of one configuration group, by camel case key name.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class UpdateConfigurationDto {
    @NotEmpty
    private Map<String, String> values;
}
