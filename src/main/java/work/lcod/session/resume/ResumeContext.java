package work.lcod.session.resume;

/**
 * Per-resume settings handed to decoders. {@code decoder} is the decoder of the envelope's version so
 * that older decoders reach the hooks newer versions override.
 */
public record ResumeContext(SessionDecoder decoder, ResumeOptions options) {}
