package com.coin.porter.common.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

@Slf4j
public class ConfigDirectoryEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {
    static final String CONFIG_DIR_PROP = "app.config.dir";
    private static final List<String> BASE_FILES = List.of("base.yml", "base.yaml");
    private static final List<String> SUBDIRECTORIES = List.of("exchanges", "networks", "secrets");

    private final YamlPropertySourceLoader loader = new YamlPropertySourceLoader();

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String configDir = environment.getProperty(CONFIG_DIR_PROP);
        if (configDir == null || configDir.isBlank()) {
            return;
        }
        Path root = Path.of(configDir.trim());
        if (!Files.isDirectory(root)) {
            LOG.warn("Config directory not found: {}", root.toAbsolutePath());
            return;
        }

        List<Path> files = new ArrayList<>();
        for (String base : BASE_FILES) {
            Path file = root.resolve(base);
            if (Files.isRegularFile(file)) {
                files.add(file);
            }
        }
        for (String sub : SUBDIRECTORIES) {
            files.addAll(yamlFilesIn(root.resolve(sub)));
        }
        for (Path file : files) {
            for (PropertySource<?> source : load(file)) {
                environment.getPropertySources().addLast(source);
            }
            LOG.info("Loaded config: {}", file.toAbsolutePath());
        }
    }

    private List<Path> yamlFilesIn(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                    .filter(path -> Files.isRegularFile(path) && isYaml(path))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString().toLowerCase()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list config directory: " + dir.toAbsolutePath(), e);
        }
    }

    private List<PropertySource<?>> load(Path file) {
        try {
            return loader.load("config: " + file, new FileSystemResource(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config file: " + file.toAbsolutePath(), e);
        }
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase();
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
