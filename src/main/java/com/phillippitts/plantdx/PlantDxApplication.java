package com.phillippitts.plantdx;

import com.phillippitts.plantdx.config.properties.DiagnosisProperties;
import com.phillippitts.plantdx.config.properties.HealthProperties;
import com.phillippitts.plantdx.config.properties.ImageProperties;
import com.phillippitts.plantdx.config.properties.ProviderProperties;
import com.phillippitts.plantdx.config.properties.RetryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        DiagnosisProperties.class,
        RetryProperties.class,
        ImageProperties.class,
        HealthProperties.class,
        ProviderProperties.class
})
@EnableScheduling
public class PlantDxApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlantDxApplication.class, args);
    }

}
