package com.craftplane.starter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "craftplane")
public class CraftPlaneProperties {

    /**
     * 总开关
     */
    private boolean enabled = true;

    /**
     * 是否允许安装未审核插件
     */
    private boolean allowUnapproved = false;

    /**
     * 依赖安装模式，true 时任一依赖失败则拒绝主插件
     */
    private boolean strictDependencies = false;

    private int subscriberBufferSize = 10;

    private Executor executor = new Executor();

    private int defaultPageSize = 50;

    private int maxPageSize = 100;

    private int maxConfigEntries = 100;

    private int maxConfigKeyLength = 100;

    private Duration baseInstallEstimate = Duration.ofSeconds(30);

    private Duration perDependencyEstimate = Duration.ofSeconds(15);

    private Duration uninstallEstimate = Duration.ofSeconds(10);

    /**
     * 启动时加载的插件目录，支持 classpath: 前缀
     */
    private String catalogLocation;

    /**
     * 启动时注册的服务器
     */
    private List<Server> servers = new ArrayList<>();

    @Data
    public static class Executor {
        private int corePoolSize = Math.max(2, Runtime.getRuntime().availableProcessors());
        private int maxPoolSize = Math.max(4, Runtime.getRuntime().availableProcessors() * 2);
        private int queueCapacity = 100;
    }

    @Data
    public static class Server {
        private String id;
        private String name;
        private String gameVersion;
    }
}
