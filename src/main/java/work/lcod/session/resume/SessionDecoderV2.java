package work.lcod.session.resume;

import java.util.Base64;
import java.util.Map;
import work.lcod.session.state.SessionMetadata;

/**
 * Adds the application blob ({@code app_blob}, base64 or {@code null}) to the metadata.
 */
public final class SessionDecoderV2 extends DelegatingSessionDecoder {
    public SessionDecoderV2(SessionDecoder previous) {
        super(previous);
    }

    @Override
    public int version() {
        return 2;
    }

    @Override
    public void validate(Map<String, Object> sessionRepr, ResumeContext context) {
        super.validate(sessionRepr, context);
        appBlob(Repr.map(sessionRepr, "metadata"));
    }

    @Override
    public void restoreMetadata(SessionMetadata metadata, Map<String, Object> metadataRepr) {
        super.restoreMetadata(metadata, metadataRepr);
        metadata.setAppBlob(appBlob(metadataRepr));
    }

    private static byte[] appBlob(Map<String, Object> metadataRepr) {
        var blob = Repr.optionalString(metadataRepr, "app_blob");
        if (blob == null) {
            return null;
        }
        try {
            return Base64.getDecoder().decode(blob);
        } catch (IllegalArgumentException ex) {
            throw new CorruptedSessionException("Value of key 'app_blob' is not correct base64", ex);
        }
    }
}
