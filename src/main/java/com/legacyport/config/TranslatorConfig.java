package com.legacyport.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 翻译器运行时配置
 *
 * 支持从 CLI 参数或 JSON 配置文件注入，覆盖 Constants 默认值
 */
public class TranslatorConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private List<String> disabledRules = new ArrayList<>();
    private List<String> skip = new ArrayList<>();
    private Map<String, String> importMappings = new LinkedHashMap<>();
    private String markerSymbol = Constants.COMPATIBILITY_MARKER;
    private String extension = Constants.SOURCE_EXTENSION;
    private int threads = Constants.DEFAULT_THREADS;

    public List<String> getDisabledRules() {
        return disabledRules;
    }

    public void setDisabledRules(List<String> disabledRules) {
        this.disabledRules = disabledRules == null ? new ArrayList<>() : new ArrayList<>(disabledRules);
    }

    public List<String> getSkip() {
        return skip;
    }

    public void setSkip(List<String> skip) {
        this.skip = skip == null ? new ArrayList<>() : new ArrayList<>(skip);
    }

    public Map<String, String> getImportMappings() {
        return importMappings;
    }

    public void setImportMappings(Map<String, String> importMappings) {
        this.importMappings = importMappings == null ? new LinkedHashMap<>() : new LinkedHashMap<>(importMappings);
    }

    public String getMarkerSymbol() {
        return markerSymbol;
    }

    public void setMarkerSymbol(String markerSymbol) {
        this.markerSymbol = markerSymbol;
    }

    public String getExtension() {
        return extension;
    }

    public void setExtension(String extension) {
        this.extension = extension;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    /**
     * 使用默认配置创建实例
     */
    public static TranslatorConfig defaults() {
        return new TranslatorConfig();
    }

    /**
     * 从 JSON 文件读取配置，缺省的字段保持默认值。
     *
     * @param file 配置文件
     * @return 配置实例
     * @throws IOException 读取或解析失败时抛出
     */
    public static TranslatorConfig load(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        if (!Files.isRegularFile(file)) {
            throw new IOException("配置文件不存在: " + file.toAbsolutePath());
        }
        try {
            TranslatorConfig config = OBJECT_MAPPER.readValue(file.toFile(), TranslatorConfig.class);
            config.validate();
            return config;
        } catch (IOException exception) {
            throw new IOException("读取配置失败: " + file.toAbsolutePath(), exception);
        }
    }

    /**
     * 校验取值范围，非法时抛出 IllegalArgumentException。
     */
    public void validate() {
        if (threads < 1) {
            throw new IllegalArgumentException("线程数必须为正数: " + threads);
        }
        if (markerSymbol == null || markerSymbol.isBlank()) {
            throw new IllegalArgumentException("兼容标记不能为空");
        }
        if (extension == null || !extension.startsWith(".") || extension.length() < 2) {
            throw new IllegalArgumentException("扩展名必须以点号开头: " + extension);
        }
    }
}
