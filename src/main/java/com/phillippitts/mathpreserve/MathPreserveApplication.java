package com.phillippitts.mathpreserve;

import com.phillippitts.mathpreserve.config.properties.CleanupProperties;
import com.phillippitts.mathpreserve.config.properties.CoordinatorProperties;
import com.phillippitts.mathpreserve.config.properties.ExtractionProperties;
import com.phillippitts.mathpreserve.config.properties.RegistryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ExtractionProperties.class,
        RegistryProperties.class,
        CoordinatorProperties.class,
        CleanupProperties.class
})
public class MathPreserveApplication {

    public static void main(String[] args) {
        SpringApplication.run(MathPreserveApplication.class, args);
    }

}
