package com.glisk.backend.generation;

import com.glisk.backend.common.error.DefaultAuthorNotFoundException;
import com.glisk.backend.common.error.PermanentServiceException;
import com.glisk.backend.recovery.config.RecoveryProperties;
import com.glisk.backend.token.entity.AuthorEntity;
import com.glisk.backend.token.repo.AuthorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptResolverTest {

    private static final String DEFAULT_WALLET = "0x1111111111111111111111111111111111111111";

    private AuthorRepository authorRepo;
    private RecoveryProperties recoveryProps;
    private PromptResolver resolver;

    @BeforeEach
    void setUp() {
        authorRepo = Mockito.mock(AuthorRepository.class);
        recoveryProps = new RecoveryProperties();
        recoveryProps.setDefaultAuthorWallet(DEFAULT_WALLET);
        resolver = new PromptResolver(authorRepo, recoveryProps);

        Mockito.when(authorRepo.findByWallet(DEFAULT_WALLET))
                .thenReturn(Optional.of(AuthorEntity.of(DEFAULT_WALLET, "default season prompt")));
    }

    @Test
    void author_prompt_is_used_when_set() {
        Mockito.when(authorRepo.findById("a1"))
                .thenReturn(Optional.of(AuthorEntity.of("0x2222222222222222222222222222222222222222", "neon koi pond")));

        assertThat(resolver.resolve(1L, "a1")).isEqualTo("neon koi pond");
    }

    @Test
    void missing_author_falls_back_to_default() {
        Mockito.when(authorRepo.findById("ghost")).thenReturn(Optional.empty());

        assertThat(resolver.resolve(1L, "ghost")).isEqualTo("default season prompt");
    }

    @Test
    void author_without_prompt_falls_back_to_default() {
        Mockito.when(authorRepo.findById("a1"))
                .thenReturn(Optional.of(AuthorEntity.of("0x2222222222222222222222222222222222222222", null)));

        assertThat(resolver.resolve(1L, "a1")).isEqualTo("default season prompt");
    }

    @Test
    void missing_default_author_is_permanent() {
        Mockito.when(authorRepo.findById("ghost")).thenReturn(Optional.empty());
        Mockito.when(authorRepo.findByWallet(DEFAULT_WALLET)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> resolver.resolve(1L, "ghost")).isInstanceOf(DefaultAuthorNotFoundException.class);
    }

    @Test
    void over_long_prompt_is_rejected() {
        Mockito.when(authorRepo.findById("a1"))
                .thenReturn(Optional.of(AuthorEntity.of("0x2222222222222222222222222222222222222222", "p".repeat(1001))));

        assertThatThrownBy(() -> resolver.resolve(1L, "a1"))
                .isInstanceOf(PermanentServiceException.class)
                .hasMessageContaining("maximum length of 1000");
    }

    @Test
    void prompt_at_limit_is_accepted() {
        assertThat(PromptValidator.validate("p".repeat(1000))).hasSize(1000);
    }
}
