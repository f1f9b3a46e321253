package org.rostilos.labgate.webserver.config;

import okhttp3.OkHttpClient;
import org.rostilos.labgate.core.resolver.TargetResolverChain;
import org.rostilos.labgate.core.service.ItemService;
import org.rostilos.labgate.core.service.PermissionService;
import org.rostilos.labgate.vcsclient.HttpAuthorizedClientFactory;
import org.rostilos.labgate.vcsclient.gitlab.GitLabClient;
import org.rostilos.labgate.vcsclient.gitlab.GitLabConnectionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires one shared GitLab client and the services built on it.
 */
@Configuration
public class GitLabClientConfig {

    private static final Logger log = LoggerFactory.getLogger(GitLabClientConfig.class);

    @Bean
    public GitLabConnectionSettings gitLabConnectionSettings(GitLabProperties properties) {
        GitLabConnectionSettings settings = properties.toConnectionSettings();
        log.info("Using GitLab API at {}", settings.apiBaseUrl());
        return settings;
    }

    @Bean
    public OkHttpClient gitLabHttpClient(GitLabConnectionSettings settings) {
        return new HttpAuthorizedClientFactory().createClient(settings);
    }

    @Bean
    public GitLabClient gitLabClient(OkHttpClient gitLabHttpClient, GitLabConnectionSettings settings) {
        return new GitLabClient(gitLabHttpClient, settings);
    }

    @Bean
    public TargetResolverChain targetResolverChain(GitLabClient gitLabClient) {
        return TargetResolverChain.groupsFirst(gitLabClient);
    }

    @Bean
    public PermissionService permissionService(GitLabClient gitLabClient, TargetResolverChain targetResolverChain) {
        return new PermissionService(gitLabClient, targetResolverChain);
    }

    @Bean
    public ItemService itemService(GitLabClient gitLabClient) {
        return new ItemService(gitLabClient);
    }
}
