package com.purchasingpower.repoagent.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GithubProperties github = new GithubProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RepositoryProperties repository = new RepositoryProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private CompletionProperties completion = new CompletionProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ContextProperties context = new ContextProperties();
}
