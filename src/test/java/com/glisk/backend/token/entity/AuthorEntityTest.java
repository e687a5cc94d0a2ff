package com.glisk.backend.token.entity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthorEntityTest {

    @Test
    void wallet_is_normalized_to_checksum_form() {
        String lower = "0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed";

        assertThat(AuthorEntity.normalizeWallet(lower)).isEqualTo("0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed");
    }

    @Test
    void invalid_wallets_are_rejected() {
        assertThatThrownBy(() -> AuthorEntity.normalizeWallet(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AuthorEntity.normalizeWallet("5aaeb6053f3e94c9b9a09f33669435e7ef1beaed"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AuthorEntity.normalizeWallet("0x1234")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blank_prompt_counts_as_unset() {
        assertThat(AuthorEntity.of("0x1111111111111111111111111111111111111111", "  ").hasPrompt()).isFalse();
        assertThat(AuthorEntity.of("0x1111111111111111111111111111111111111111", "a fox").hasPrompt()).isTrue();
    }
}
