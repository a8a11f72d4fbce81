/**
 * AppConfig.java
 *
 * Application-level beans.
 */
package club.ppmc.keynav.config;

import com.google.gson.Gson;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * Gson instance used to serialize narration events for the WebSocket topic.
     */
    @Bean
    public Gson gson() {
        return new Gson();
    }
}
