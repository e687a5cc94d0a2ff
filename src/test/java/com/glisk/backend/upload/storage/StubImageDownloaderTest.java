package com.glisk.backend.upload.storage;

import com.glisk.backend.common.error.PermanentServiceException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StubImageDownloaderTest {

    private final StubImageDownloader downloader = new StubImageDownloader();

    @Test
    void same_url_gives_same_placeholder_bytes() {
        byte[] first = downloader.download("https://stub.glisk.local/images/abc.png");

        assertThat(first).isNotEmpty().isEqualTo(downloader.download("https://stub.glisk.local/images/abc.png"));
        assertThat(first).isNotEqualTo(downloader.download("https://stub.glisk.local/images/def.png"));
    }

    @Test
    void missing_url_is_still_permanent() {
        assertThatThrownBy(() -> downloader.download(null))
                .isInstanceOfSatisfying(PermanentServiceException.class,
                        e -> assertThat(e.code()).isEqualTo("IMAGE_URL_MISSING"));
    }
}
