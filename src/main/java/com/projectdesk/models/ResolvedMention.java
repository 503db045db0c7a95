package com.projectdesk.models;

/**
 * A classified {@code @token} from a prompt.
 *
 * @param kind         classification
 * @param token        the token as written, including {@code @}
 * @param relativePath for INPUT/GUIDELINE/OUTPUT the path below that root, for ALIAS the
 *                     project-relative alias target, for RAW the token without {@code @}
 */
public record ResolvedMention(MentionKind kind, String token, String relativePath) {
}
