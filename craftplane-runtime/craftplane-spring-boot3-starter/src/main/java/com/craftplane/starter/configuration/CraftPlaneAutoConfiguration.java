package com.craftplane.starter.configuration;

import com.craftplane.api.model.ServerInstance;
import com.craftplane.core.audit.AsyncAuditLogger;
import com.craftplane.core.backend.LoggingComputeBackend;
import com.craftplane.core.config.CraftPlaneConfig;
import com.craftplane.core.executor.ThreadPoolInstallationExecutor;
import com.craftplane.core.install.stream.InstallUpdateRegistry;
import com.craftplane.core.loader.PluginCatalogLoader;
import com.craftplane.core.plugin.PluginManager;
import com.craftplane.core.repository.InMemoryInstallationRepository;
import com.craftplane.core.repository.InMemoryPluginCatalogRepository;
import com.craftplane.core.repository.InMemoryServerRepository;
import com.craftplane.core.spi.AuditSink;
import com.craftplane.core.spi.ComputeBackend;
import com.craftplane.core.spi.InstallationExecutor;
import com.craftplane.core.spi.InstallationRepository;
import com.craftplane.core.spi.PluginCatalogRepository;
import com.craftplane.core.spi.ServerRepository;
import com.craftplane.core.version.LexicographicVersionComparator;
import com.craftplane.core.version.VersionComparator;
import com.craftplane.starter.config.CraftPlaneProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(CraftPlaneProperties.class)
@ConditionalOnProperty(prefix = "craftplane", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CraftPlaneAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CraftPlaneConfig craftPlaneConfig(CraftPlaneProperties properties) {
        CraftPlaneConfig config = CraftPlaneConfig.builder()
                .allowUnapproved(properties.isAllowUnapproved())
                .strictDependencies(properties.isStrictDependencies())
                .subscriberBufferSize(properties.getSubscriberBufferSize())
                .executorCorePoolSize(properties.getExecutor().getCorePoolSize())
                .executorMaxPoolSize(properties.getExecutor().getMaxPoolSize())
                .executorQueueCapacity(properties.getExecutor().getQueueCapacity())
                .defaultPageSize(properties.getDefaultPageSize())
                .maxPageSize(properties.getMaxPageSize())
                .maxConfigEntries(properties.getMaxConfigEntries())
                .maxConfigKeyLength(properties.getMaxConfigKeyLength())
                .baseInstallEstimate(properties.getBaseInstallEstimate())
                .perDependencyEstimate(properties.getPerDependencyEstimate())
                .uninstallEstimate(properties.getUninstallEstimate())
                .build();
        log.info("CraftPlane config: {}", config);
        return config;
    }

    // ==================== 存储 ====================

    @Bean
    @ConditionalOnMissingBean(PluginCatalogRepository.class)
    public InMemoryPluginCatalogRepository pluginCatalogRepository(CraftPlaneProperties properties) {
        InMemoryPluginCatalogRepository catalog = new InMemoryPluginCatalogRepository();
        String location = properties.getCatalogLocation();
        if (location != null && !location.isBlank()) {
            PluginCatalogLoader.load(location).forEach(catalog::register);
        }
        return catalog;
    }

    @Bean
    @ConditionalOnMissingBean(InstallationRepository.class)
    public InMemoryInstallationRepository installationRepository() {
        return new InMemoryInstallationRepository();
    }

    @Bean
    @ConditionalOnMissingBean(ServerRepository.class)
    public InMemoryServerRepository serverRepository(CraftPlaneProperties properties) {
        InMemoryServerRepository servers = new InMemoryServerRepository();
        for (CraftPlaneProperties.Server server : properties.getServers()) {
            servers.register(ServerInstance.builder()
                    .id(server.getId())
                    .name(server.getName() != null ? server.getName() : server.getId())
                    .gameVersion(server.getGameVersion())
                    .build());
        }
        return servers;
    }

    // ==================== 外部协作者 ====================

    // 默认只打日志，接入真实计算平台时替换
    @Bean
    @ConditionalOnMissingBean
    public ComputeBackend computeBackend() {
        return new LoggingComputeBackend();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink() {
        return new AsyncAuditLogger();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public InstallationExecutor installationExecutor(CraftPlaneConfig config) {
        return new ThreadPoolInstallationExecutor(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public VersionComparator versionComparator() {
        return new LexicographicVersionComparator();
    }

    @Bean
    @ConditionalOnMissingBean
    public InstallUpdateRegistry installUpdateRegistry(CraftPlaneConfig config) {
        return new InstallUpdateRegistry(config.getSubscriberBufferSize());
    }

    // ==================== 入口 ====================

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public PluginManager pluginManager(CraftPlaneConfig config,
                                       PluginCatalogRepository catalog,
                                       InstallationRepository installations,
                                       ServerRepository servers,
                                       ComputeBackend computeBackend,
                                       AuditSink auditSink,
                                       InstallationExecutor executor,
                                       InstallUpdateRegistry updateRegistry,
                                       VersionComparator versionComparator) {
        return new PluginManager(config, catalog, installations, servers, computeBackend, auditSink, executor,
                updateRegistry, versionComparator, null, null);
    }
}
