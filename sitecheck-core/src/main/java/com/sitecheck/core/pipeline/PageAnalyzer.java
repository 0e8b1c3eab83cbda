package com.sitecheck.core.pipeline;

import com.sitecheck.common.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * On-page checks over raw HTML: title, description, headings, content length, image alt
 * text, viewport and HTTPS.
 */
@Component
@RequiredArgsConstructor
public class PageAnalyzer {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;
    private static final Pattern TITLE = Pattern.compile("<title[^>]*>(.*?)</title>", FLAGS);
    private static final Pattern META_TAG = Pattern.compile("<meta\\s[^>]*>", FLAGS);
    private static final Pattern H1 = Pattern.compile("<h1[\\s>]", FLAGS);
    private static final Pattern H2 = Pattern.compile("<h2[\\s>]", FLAGS);
    private static final Pattern IMG = Pattern.compile("<img\\s[^>]*>", FLAGS);
    private static final Pattern BODY = Pattern.compile("<body[^>]*>(.*)</body>", FLAGS);
    private static final Pattern SCRIPT_OR_STYLE = Pattern.compile("<(script|style)[^>]*>.*?</\\1>", FLAGS);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");

    private final PipelineProperties properties;

    public PageAnalysis analyze(FetchedPage page) {
        String html = page.getBody();
        List<AuditIssue> issues = new ArrayList<>();

        String title = firstGroup(TITLE, html);
        if (title == null || title.isBlank()) {
            issues.add(issue("Missing page title", AuditIssue.Severity.HIGH,
                "Search engines need a title to understand what your page is about.",
                "Add a clear, descriptive title (50-60 characters) that describes your page content.", 25));
        } else if (title.length() < 30) {
            issues.add(issue("Page title is too short", AuditIssue.Severity.MEDIUM,
                "Title is only " + title.length() + " characters.",
                "Make your title longer (aim for 50-60 characters) and include your main keywords.", 10));
        } else if (title.length() > 60) {
            issues.add(issue("Page title is too long", AuditIssue.Severity.LOW,
                "Title is " + title.length() + " characters and will be cut off in search results.",
                "Shorten your title to 50-60 characters.", 5));
        }

        String description = metaContent(html, "name", "description");
        if (description == null || description.isBlank()) {
            issues.add(issue("Missing page description", AuditIssue.Severity.HIGH,
                "Descriptions help people decide if they want to visit your site from search results.",
                "Add a description (150-160 characters) that explains what your page offers.", 20));
        } else if (description.length() < 120) {
            issues.add(issue("Page description is too short", AuditIssue.Severity.MEDIUM,
                "Description is only " + description.length() + " characters.",
                "Expand your description to 150-160 characters.", 10));
        }

        int h1Count = count(H1, html);
        if (h1Count == 0) {
            issues.add(issue("Missing main heading (H1)", AuditIssue.Severity.HIGH,
                "The main heading helps search engines and visitors understand your page topic.",
                "Add one H1 heading at the top of your main content.", 20));
        } else if (h1Count > 1) {
            issues.add(issue("Multiple main headings found", AuditIssue.Severity.MEDIUM,
                "Found " + h1Count + " H1 tags (should be 1).",
                "Keep only one H1 tag and use H2, H3 for other headings.", 10));
        }

        int wordCount = wordCount(html);
        if (wordCount < properties.getMinWordCount()) {
            issues.add(issue("Page has very little content", AuditIssue.Severity.MEDIUM,
                "Page has only " + wordCount + " words.",
                "Add more helpful content to your page (aim for at least 300-500 words).", 15));
        }

        int totalImages = 0;
        int missingAlt = 0;
        Matcher images = IMG.matcher(html);
        while (images.find()) {
            totalImages++;
            String tag = images.group();
            String src = attribute(tag, "src");
            if (src != null && !src.startsWith("data:") && attribute(tag, "alt") == null) {
                missingAlt++;
            }
        }
        if (missingAlt > 0) {
            issues.add(issue(missingAlt + " image" + (missingAlt > 1 ? "s" : "") + " missing descriptions",
                missingAlt > 5 ? AuditIssue.Severity.HIGH : AuditIssue.Severity.MEDIUM,
                missingAlt + " images have no alt attribute.",
                "Add descriptive alt text to all images describing what they show.",
                Math.min(15, missingAlt * 2)));
        }

        boolean hasViewport = metaContent(html, "name", "viewport") != null;
        if (!hasViewport) {
            issues.add(issue("Missing mobile viewport setting", AuditIssue.Severity.HIGH,
                "Without a viewport tag phones render the desktop layout zoomed out.",
                "Add <meta name=\"viewport\" content=\"width=device-width, initial-scale=1\">.", 15));
        }

        boolean https = UrlUtils.isHttps(page.getUrl());
        if (!https) {
            issues.add(issue("Site is not using HTTPS", AuditIssue.Severity.HIGH,
                "Browsers mark plain HTTP pages as not secure.",
                "Install an SSL certificate and redirect all traffic to HTTPS.", 20));
        }

        int penalty = issues.stream().mapToInt(AuditIssue::getPenalty).sum();

        return PageAnalysis.builder()
            .url(page.getUrl())
            .httpStatus(page.getHttpStatus())
            .https(https)
            .title(title)
            .metaDescription(description)
            .h1Count(h1Count)
            .h2Count(count(H2, html))
            .wordCount(wordCount)
            .totalImages(totalImages)
            .missingAltText(missingAlt)
            .hasViewport(hasViewport)
            .score(Math.max(0, 100 - penalty))
            .issues(issues)
            .build();
    }

    private AuditIssue issue(String title, AuditIssue.Severity severity, String explanation, String fix, int penalty) {
        return AuditIssue.builder()
            .title(title)
            .severity(severity)
            .explanation(explanation)
            .suggestedFix(fix)
            .penalty(penalty)
            .build();
    }

    private String firstGroup(Pattern pattern, String html) {
        Matcher matcher = pattern.matcher(html);
        return matcher.find() ? matcher.group(1).replaceAll("\\s+", " ").trim() : null;
    }

    private int count(Pattern pattern, String html) {
        Matcher matcher = pattern.matcher(html);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private String metaContent(String html, String keyAttribute, String keyValue) {
        Matcher matcher = META_TAG.matcher(html);
        while (matcher.find()) {
            String tag = matcher.group();
            if (keyValue.equalsIgnoreCase(attribute(tag, keyAttribute))) {
                String content = attribute(tag, "content");
                return content != null ? content.trim() : "";
            }
        }
        return null;
    }

    private String attribute(String tag, String name) {
        Matcher matcher = Pattern.compile("\\s" + name + "\\s*=\\s*(\"([^\"]*)\"|'([^']*)'|([^\\s>]+))", FLAGS)
            .matcher(tag);
        if (!matcher.find()) {
            return null;
        }
        for (int group = 2; group <= 4; group++) {
            if (matcher.group(group) != null) {
                return matcher.group(group);
            }
        }
        return "";
    }

    private int wordCount(String html) {
        String body = firstGroupRaw(BODY, html);
        String text = SCRIPT_OR_STYLE.matcher(body != null ? body : html).replaceAll(" ");
        text = TAG.matcher(text).replaceAll(" ").replaceAll("\\s+", " ").trim();
        return text.isEmpty() ? 0 : text.split(" ").length;
    }

    private String firstGroupRaw(Pattern pattern, String html) {
        Matcher matcher = pattern.matcher(html);
        return matcher.find() ? matcher.group(1) : null;
    }
}
