package com.glisk.backend.upload.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.glisk.backend.common.error.PermanentServiceException;
import com.glisk.backend.common.error.ServiceErrorMapper;
import com.glisk.backend.common.error.ServiceException;
import com.glisk.backend.common.error.TransientServiceException;
import com.glisk.backend.upload.config.PinataProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.client.RestClient;

import java.util.Locale;

/**
 * Pinata pinning API, CIDv1.
 * <pre>
 * POST /pinning/pinFileToIPFS  multipart: file, pinataOptions, pinataMetadata
 * POST /pinning/pinJSONToIPFS  {"pinataContent": ..., "pinataOptions": ..., "pinataMetadata": ...}
 * </pre>
 * Both answer {@code {"IpfsHash": "<cid>", ...}}.
 */
@Slf4j
public class PinataStorageClient implements StorageClient {

    private static final String CODE_PREFIX = "STORAGE";

    private final RestClient http;
    private final PinataProperties props;
    private final ObjectMapper om;

    public PinataStorageClient(RestClient http, PinataProperties props, ObjectMapper om) {
        this.http = http;
        this.props = props;
        this.om = om;
    }

    @Override
    public String uploadBytes(byte[] data, String fileName) {
        try {
            MultipartBodyBuilder mb = new MultipartBodyBuilder();
            mb.part("file", new NamedResource(data, fileName), guessType(fileName));
            mb.part("pinataOptions", options().toString());
            mb.part("pinataMetadata", metadata(fileName).toString());

            String raw = http.post()
                    .uri("/pinning/pinFileToIPFS")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(mb.build())
                    .retrieve()
                    .body(String.class);

            String cid = extractCid(raw);
            log.info("pinata.file.ok file={} bytes={} cid={} url={}", fileName, data.length, cid, gatewayUrl(cid));
            return cid;
        } catch (ServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ServiceErrorMapper.map(CODE_PREFIX, e);
        }
    }

    @Override
    public String uploadJson(JsonNode json, String name) {
        try {
            ObjectNode payload = om.createObjectNode();
            payload.set("pinataContent", json);
            payload.set("pinataOptions", options());
            payload.set("pinataMetadata", metadata(name));

            String raw = http.post()
                    .uri("/pinning/pinJSONToIPFS")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload.toString())
                    .retrieve()
                    .body(String.class);

            String cid = extractCid(raw);
            log.info("pinata.json.ok name={} cid={}", name, cid);
            return cid;
        } catch (ServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ServiceErrorMapper.map(CODE_PREFIX, e);
        }
    }

    public String gatewayUrl(String cid) {
        return "https://" + props.getGateway() + "/ipfs/" + cid;
    }

    private ObjectNode options() {
        ObjectNode o = om.createObjectNode();
        o.put("cidVersion", 1);
        return o;
    }

    private ObjectNode metadata(String name) {
        ObjectNode m = om.createObjectNode();
        m.put("name", name);
        return m;
    }

    private String extractCid(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new TransientServiceException(CODE_PREFIX + "_EMPTY_RESPONSE", "empty body from pinata");
        }
        JsonNode root;
        try {
            root = om.readTree(raw);
        } catch (Exception e) {
            throw new TransientServiceException(CODE_PREFIX + "_BAD_RESPONSE", "unparseable pinata body", null, e);
        }
        String cid = root.path("IpfsHash").asText(null);
        if (cid == null || cid.isBlank()) {
            throw new PermanentServiceException(CODE_PREFIX + "_NO_CID", "pinata response without IpfsHash");
        }
        return cid;
    }

    private static MediaType guessType(String fileName) {
        String f = fileName.toLowerCase(Locale.ROOT);
        if (f.endsWith(".png")) return MediaType.IMAGE_PNG;
        if (f.endsWith(".jpg") || f.endsWith(".jpeg")) return MediaType.IMAGE_JPEG;
        if (f.endsWith(".json")) return MediaType.APPLICATION_JSON;
        return MediaType.APPLICATION_OCTET_STREAM;
    }

    /** multipart needs a filename on the part, which a bare ByteArrayResource does not carry */
    private static final class NamedResource extends ByteArrayResource {

        private final String fileName;

        private NamedResource(byte[] data, String fileName) {
            super(data);
            this.fileName = fileName;
        }

        @Override
        public String getFilename() {
            return fileName;
        }
    }
}
