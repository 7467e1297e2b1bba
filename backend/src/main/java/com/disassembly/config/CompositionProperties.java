package com.disassembly.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Settings under {@code composition.*}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "composition")
public class CompositionProperties {

    @Valid
    private Query query = new Query();

    @Valid
    private Storage storage = new Storage();

    @Data
    public static class Query {

        /**
         * Upper bound for the depth of tree reads.
         */
        @Min(1)
        @Max(5)
        private int maxDepth = 5;

        @Min(1)
        @Max(5)
        private int defaultDepth = 1;
    }

    @Data
    public static class Storage {

        /**
         * Directory holding the bytes of product files.
         */
        @NotBlank
        private String root = "./data/files";
    }
}
