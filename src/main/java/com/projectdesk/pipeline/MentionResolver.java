package com.projectdesk.pipeline;

import com.projectdesk.models.MentionKind;
import com.projectdesk.models.MentionResolution;
import com.projectdesk.models.Project;
import com.projectdesk.models.ResolvedMention;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies {@code @token} mentions in a prompt and expands them to project-relative paths.
 *
 * Rules, in order:
 *   - exact alias key        -> ALIAS, path = alias target
 *   - "input/..."            -> INPUT, path below the input root
 *   - "guideline/..."        -> GUIDELINE, path below the guideline root
 *   - "output/..."           -> OUTPUT, path below the write root
 *   - anything else          -> RAW, left untouched in the expanded prompt
 *
 * Performs no I/O; paths are checked by the sandbox when they are used.
 */
public class MentionResolver {

    static final Pattern MENTION = Pattern.compile("@([\\w\\-./]+)", Pattern.UNICODE_CHARACTER_CLASS);

    private static final String INPUT_PREFIX = "input/";
    private static final String GUIDELINE_PREFIX = "guideline/";
    private static final String OUTPUT_PREFIX = "output/";

    public MentionResolution resolve(String prompt, Project project) {
        if (prompt == null || prompt.isEmpty()) {
            return new MentionResolution("", List.of());
        }
        List<ResolvedMention> mentions = new ArrayList<>();
        StringBuilder expanded = new StringBuilder();
        Matcher m = MENTION.matcher(prompt);
        int last = 0;
        while (m.find()) {
            String body = m.group(1);
            // sentence punctuation is not part of the path
            int trimmed = body.length();
            while (trimmed > 0 && body.charAt(trimmed - 1) == '.') {
                trimmed--;
            }
            if (trimmed == 0) {
                continue;
            }
            body = body.substring(0, trimmed);
            int tokenEnd = m.start() + 1 + trimmed;

            ResolvedMention mention = classify(body, project);
            mentions.add(mention);
            expanded.append(prompt, last, m.start());
            expanded.append(expand(mention, project));
            last = tokenEnd;
        }
        expanded.append(prompt.substring(last));
        return new MentionResolution(expanded.toString(), mentions);
    }

    ResolvedMention classify(String body, Project project) {
        String token = "@" + body;
        String alias = project.getAliases().get(body);
        if (alias != null) {
            return new ResolvedMention(MentionKind.ALIAS, token, alias);
        }
        if (body.startsWith(INPUT_PREFIX)) {
            return new ResolvedMention(MentionKind.INPUT, token, body.substring(INPUT_PREFIX.length()));
        }
        if (body.startsWith(GUIDELINE_PREFIX)) {
            return new ResolvedMention(MentionKind.GUIDELINE, token, body.substring(GUIDELINE_PREFIX.length()));
        }
        if (body.startsWith(OUTPUT_PREFIX)) {
            return new ResolvedMention(MentionKind.OUTPUT, token, body.substring(OUTPUT_PREFIX.length()));
        }
        return new ResolvedMention(MentionKind.RAW, token, body);
    }

    /**
     * Project-relative path named by one mention body ({@code input/a.md}, an alias key, ...).
     * Unprefixed bodies are returned as given.
     */
    public String projectPath(String body, Project project) {
        ResolvedMention mention = classify(body, project);
        return mention.kind() == MentionKind.RAW ? body : expand(mention, project);
    }

    private String expand(ResolvedMention mention, Project project) {
        switch (mention.kind()) {
            case ALIAS:
                return mention.relativePath();
            case INPUT:
                return join(project.getInputDir(), mention.relativePath());
            case GUIDELINE:
                return join(project.getGuidelineDir(), mention.relativePath());
            case OUTPUT:
                return join(project.getWriteDir(), mention.relativePath());
            case RAW:
            default:
                return mention.token();
        }
    }

    private static String join(String dir, String path) {
        return path.isEmpty() ? dir : dir + "/" + path;
    }
}
