package proto.runtime.mirror;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 类属性显示过滤器。
 *
 * <p>文件格式：每行一个类，{@code ClassName field1,field2}，首个词为类名，
 * 其余以逗号或空格分隔；{@code ;} 开头的行为注释。只写类名的行表示该类不过滤。</p>
 *
 * <p>同一文件只加载一次，加载后只读，多个镜像共享。文件不存在或格式错误时视为无过滤。</p>
 */
public final class PropertyFilter {

    private static final Logger LOG = Logger.getLogger(PropertyFilter.class.getName());

    /** 不过滤任何类 */
    public static final PropertyFilter NONE = new PropertyFilter(Collections.emptyMap());

    private static final Cache<String, PropertyFilter> REGISTRY = Caffeine.newBuilder()
            .maximumSize(64)
            .build();

    private final Map<String, List<String>> visibleProperties;

    private PropertyFilter(Map<String, List<String>> visibleProperties) {
        this.visibleProperties = visibleProperties;
    }

    /**
     * 获取路径对应的过滤器，首次访问时加载
     *
     * @param pathName 过滤文件路径，为 null 时返回 {@link #NONE}
     */
    public static PropertyFilter forPath(String pathName) {
        if (pathName == null) {
            return NONE;
        }
        String key;
        try {
            key = Paths.get(pathName).toAbsolutePath().normalize().toString();
        } catch (InvalidPathException e) {
            LOG.log(Level.WARNING, "属性过滤文件路径无效，忽略: " + pathName, e);
            return NONE;
        }
        return REGISTRY.get(key, k -> load(Paths.get(k)));
    }

    static PropertyFilter load(Path path) {
        if (!Files.isRegularFile(path)) {
            return NONE;
        }
        try {
            return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.WARNING, "属性过滤文件无效，忽略: " + path, e);
            return NONE;
        }
    }

    /**
     * 解析过滤文件内容
     *
     * @throws IllegalArgumentException 同一个类出现两次
     */
    public static PropertyFilter parse(List<String> lines) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith(";")) {
                continue;
            }
            String[] tokens = line.split("[ ,]");
            String className = tokens[0];
            List<String> props = null;
            for (int i = 1; i < tokens.length; i++) {
                if (tokens[i].trim().isEmpty()) {
                    continue;
                }
                if (props == null) {
                    props = new ArrayList<>();
                }
                props.add(tokens[i].trim());
            }
            if (result.containsKey(className)) {
                throw new IllegalArgumentException("Duplicate class in property filter: " + className);
            }
            result.put(className, props != null ? Collections.unmodifiableList(props) : null);
        }
        return new PropertyFilter(Collections.unmodifiableMap(result));
    }

    /**
     * 类的可见属性名
     *
     * @return 未被过滤的类返回 null
     */
    public List<String> getVisibleProperties(String className) {
        return visibleProperties.get(className);
    }

    public boolean isEmpty() {
        return visibleProperties.isEmpty();
    }

    /** 清空共享缓存（测试用） */
    static void clearRegistry() {
        REGISTRY.invalidateAll();
    }
}
