package com.purchasingpower.repoagent.context;

import com.purchasingpower.repoagent.util.FileNames;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks the files worth showing to a model when the whole repository will not fit.
 *
 * <p>Three passes, each only adding paths not chosen yet:
 * <ol>
 *   <li>well-known project files, pattern by pattern in {@link #IMPORTANT_PATTERNS} order</li>
 *   <li>files with the repository's dominant source extension</li>
 *   <li>anything else in traversal order</li>
 * </ol>
 * Output depends only on the input list and the budget.
 */
@Component
public class RelevanceSelector {

    static final List<Pattern> IMPORTANT_PATTERNS = List.of(
            fileName("readme\\.md"),
            fileName("requirements\\.txt"),
            fileName("setup\\.py"),
            fileName("package\\.json"),
            fileName("main\\.(py|js|ts)"),
            fileName("index\\.(py|js|ts)"),
            fileName("app\\.(py|js|ts)"),
            fileName("pom\\.xml"),
            fileName("build\\.gradle(\\.kts)?"),
            fileName("(main|application)\\.java"),
            fileName("go\\.mod"),
            fileName("cargo\\.toml"),
            fileName("main\\.go"));

    static final Set<String> SOURCE_EXTENSIONS = Set.of(
            "py", "js", "ts", "jsx", "tsx", "java", "kt", "scala", "go", "rs", "rb", "php",
            "cs", "c", "h", "cpp", "hpp", "swift", "m", "dart", "lua", "sh");

    public List<String> select(List<String> filePaths, int maxFiles) {
        Set<String> selected = new LinkedHashSet<>();
        if (maxFiles <= 0 || filePaths.isEmpty()) {
            return List.of();
        }

        for (Pattern pattern : IMPORTANT_PATTERNS) {
            for (String path : filePaths) {
                if (selected.size() >= maxFiles) {
                    return List.copyOf(selected);
                }
                if (pattern.matcher(FileNames.fileName(path)).matches()) {
                    selected.add(path);
                }
            }
        }

        String dominant = dominantSourceExtension(filePaths);
        if (dominant != null) {
            for (String path : filePaths) {
                if (selected.size() >= maxFiles) {
                    return List.copyOf(selected);
                }
                if (dominant.equals(FileNames.extension(path))) {
                    selected.add(path);
                }
            }
        }

        for (String path : filePaths) {
            if (selected.size() >= maxFiles) {
                break;
            }
            selected.add(path);
        }
        return List.copyOf(selected);
    }

    /**
     * Up to {@code limit} files sharing the extension of {@code fileName}, in traversal order.
     * Used as style reference when creating a new file.
     */
    public List<String> similarByExtension(List<String> filePaths, String fileName, int limit) {
        String extension = FileNames.extension(fileName);
        List<String> similar = new ArrayList<>();
        for (String path : filePaths) {
            if (similar.size() >= limit) {
                break;
            }
            if (extension.equals(FileNames.extension(path))) {
                similar.add(path);
            }
        }
        return similar;
    }

    /**
     * Most frequent source extension; ties go to the one seen first.
     */
    String dominantSourceExtension(List<String> filePaths) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String path : filePaths) {
            String ext = FileNames.extension(path);
            if (SOURCE_EXTENSIONS.contains(ext)) {
                counts.merge(ext, 1, Integer::sum);
            }
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static Pattern fileName(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
