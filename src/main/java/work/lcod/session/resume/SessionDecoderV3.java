package work.lcod.session.resume;

import java.util.Map;
import work.lcod.session.state.SessionMetadata;

/**
 * Adds the application id ({@code app_id}) to the metadata.
 */
public final class SessionDecoderV3 extends DelegatingSessionDecoder {
    public SessionDecoderV3(SessionDecoder previous) {
        super(previous);
    }

    @Override
    public int version() {
        return 3;
    }

    @Override
    public void validate(Map<String, Object> sessionRepr, ResumeContext context) {
        super.validate(sessionRepr, context);
        Repr.optionalString(Repr.map(sessionRepr, "metadata"), "app_id");
    }

    @Override
    public void restoreMetadata(SessionMetadata metadata, Map<String, Object> metadataRepr) {
        super.restoreMetadata(metadata, metadataRepr);
        metadata.setAppId(Repr.optionalString(metadataRepr, "app_id"));
    }
}
