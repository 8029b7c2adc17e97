package com.tenantoptions.cli;

import com.tenantoptions.audit.ConfigurationAuditor;
import com.tenantoptions.store.OptionCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CliConfiguration {

    @Bean
    public ConfigurationAuditor configurationAuditor(OptionCatalog optionCatalog) {
        return new ConfigurationAuditor(optionCatalog);
    }
}
