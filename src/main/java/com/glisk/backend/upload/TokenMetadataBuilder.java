package com.glisk.backend.upload;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** ERC-721 metadata document and the file names used when pinning. */
@RequiredArgsConstructor
@Component
public class TokenMetadataBuilder {

    static final String DESCRIPTION = "GLISK Season 0. https://x.com/getglisk";

    private final ObjectMapper om;

    public ObjectNode build(long tokenId, String imageCid) {
        ObjectNode m = om.createObjectNode();
        m.put("name", "GLISK S0 #" + tokenId);
        m.put("description", DESCRIPTION);
        m.put("image", "ipfs://" + imageCid);
        m.putArray("attributes");
        return m;
    }

    public static String imageFileName(long tokenId) {
        return "s0-token-" + tokenId + ".png";
    }

    public static String metadataFileName(long tokenId) {
        return "s0-token-" + tokenId + "-metadata.json";
    }
}
