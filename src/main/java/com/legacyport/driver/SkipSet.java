package com.legacyport.driver;

import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * 不参与翻译的文件集合，条目可以是裸文件名、绝对路径或相对根目录的路径。
 * 目录条目对其下所有文件生效。
 */
public final class SkipSet {
    private final Set<String> entries;

    private SkipSet(Set<String> entries) {
        this.entries = Set.copyOf(entries);
    }

    public static SkipSet empty() {
        return new SkipSet(Set.of());
    }

    public static SkipSet of(Collection<String> rawEntries) {
        Set<String> normalized = new HashSet<>();
        if (rawEntries != null) {
            for (String rawEntry : rawEntries) {
                if (rawEntry == null || rawEntry.isBlank()) {
                    continue;
                }
                normalized.add(normalize(rawEntry.trim()));
            }
        }
        return new SkipSet(normalized);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * 判断文件或其任一上级目录（直到 root 为止）是否命中跳过集合。
     */
    public boolean matches(Path root, Path file) {
        if (entries.isEmpty()) {
            return false;
        }
        Path absoluteRoot = root.toAbsolutePath().normalize();
        Path absoluteFile = file.toAbsolutePath().normalize();
        Path relative = absoluteRoot.relativize(absoluteFile);

        Path prefix = null;
        for (Path component : relative) {
            prefix = prefix == null ? component : prefix.resolve(component);
            if (entries.contains(component.toString())
                    || entries.contains(toSlashPath(prefix))
                    || entries.contains(toSlashPath(absoluteRoot.resolve(prefix)))) {
                return true;
            }
        }
        Path fileName = absoluteFile.getFileName();
        return entries.contains(toSlashPath(absoluteFile))
            || (fileName != null && entries.contains(fileName.toString()));
    }

    private static String normalize(String rawEntry) {
        String entry = rawEntry.replace('\\', '/');
        while (entry.length() > 1 && entry.endsWith("/")) {
            entry = entry.substring(0, entry.length() - 1);
        }
        Path path = Path.of(entry);
        if (path.isAbsolute()) {
            return toSlashPath(path.normalize());
        }
        if (entry.startsWith("./")) {
            entry = entry.substring(2);
        }
        return entry;
    }

    static String toSlashPath(Path path) {
        return path.toString().replace('\\', '/');
    }
}
