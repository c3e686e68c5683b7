package schedulerapp.config;

import org.springframework.boot.jackson.autoconfigure.JsonMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

/**
 * Jackson configuration for the stored kwargs encoding.
 *
 * <p>Map entries are written in key order, so two tasks created with the same argument
 * bundle store byte-identical {@code kwargs} text regardless of the map implementation the
 * caller used.
 */
@Configuration
public class JacksonConfig {

    /**
     * Customizes the Jackson 3 JsonMapper to sort map entries by key.
     *
     * @return customizer for the JsonMapper builder
     */
    @Bean
    public JsonMapperBuilderCustomizer sortedKwargsCustomizer() {
        return builder -> configureSortedMaps(builder);
    }

    private void configureSortedMaps(final JsonMapper.Builder builder) {
        builder.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }
}
