package com.projectdesk.providers;

/**
 * The language model as an opaque capability: prompt in, text out.
 * Implementations throw {@link com.projectdesk.ProjectDeskException} of kind GENERATION_FAILURE
 * when the call fails or times out.
 */
public interface TextGenerator {

    String generate(String prompt, GenerationContext context) throws InterruptedException;
}
