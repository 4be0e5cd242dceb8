package com.purchasingpower.repoagent.util;

import com.purchasingpower.repoagent.exception.InvalidReferenceException;
import com.purchasingpower.repoagent.model.RepositoryLocator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses repository web/clone URLs of the form {@code host/owner/name}.
 *
 * <p>Accepted examples:
 * <ul>
 *   <li>https://github.com/user/repo</li>
 *   <li>https://github.com/user/repo.git</li>
 *   <li>https://github.com/user/repo/tree/branch-name</li>
 *   <li>github.com/user/repo</li>
 * </ul>
 *
 * <p>Parsing is purely syntactic, so it runs before any network call and the same
 * input always yields the same owner/name.
 */
@Slf4j
@Component
public class RepositoryUrlParser {

    private static final Pattern REPO_URL = Pattern.compile(
            "^(?:https?://)?(?:www\\.)?"
                    + "(?<host>[A-Za-z0-9-]+(?:\\.[A-Za-z0-9-]+)+)(?::\\d+)?"
                    + "/(?<owner>[A-Za-z0-9_.-]+)"
                    + "/(?<name>[A-Za-z0-9_.-]+?)(?:\\.git)?"
                    + "(?:/.*)?/?$");

    /**
     * @param url repository URL
     * @return parsed locator
     * @throws InvalidReferenceException if the URL is blank or does not match {@code host/owner/name}
     */
    public RepositoryLocator parse(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidReferenceException(String.valueOf(url), "URL cannot be null or blank");
        }
        String trimmed = url.trim();
        Matcher matcher = REPO_URL.matcher(trimmed);
        if (!matcher.matches()) {
            throw new InvalidReferenceException(trimmed, "expected host/owner/name");
        }

        String host = matcher.group("host").toLowerCase();
        String owner = matcher.group("owner");
        String name = matcher.group("name");
        if (isDotSegment(owner) || isDotSegment(name)) {
            throw new InvalidReferenceException(trimmed, "owner and name must not be '.' or '..'");
        }

        String cloneUrl = "https://" + host + "/" + owner + "/" + name + ".git";
        log.debug("Parsed repository URL: {} -> host={}, owner={}, name={}", trimmed, host, owner, name);
        return new RepositoryLocator(host, owner, name, cloneUrl);
    }

    private static boolean isDotSegment(String segment) {
        return ".".equals(segment) || "..".equals(segment);
    }
}
