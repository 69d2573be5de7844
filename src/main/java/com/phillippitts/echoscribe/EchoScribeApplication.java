package com.phillippitts.echoscribe;

import com.phillippitts.echoscribe.config.settings.AiServiceSettings;
import com.phillippitts.echoscribe.config.settings.StartupValidationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AiServiceSettings.class,
        StartupValidationProperties.class
})
public class EchoScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(EchoScribeApplication.class, args);
    }

}
