package com.investigation.linkage.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CrossReferenceIndexTest {

    @Test
    void lookups_trimRawIdentifiers() {
        CrossReferenceIndex index = CrossReferenceIndex.builder()
                .phone(" 0811111111 ", "person:1100")
                .account("ACC1", "person:1100")
                .wallet("0xabc", "person:2200")
                .build();

        assertThat(index.personForPhone("0811111111")).contains("person:1100");
        assertThat(index.personForAccount(" ACC1")).contains("person:1100");
        assertThat(index.personForWallet("0xabc")).contains("person:2200");
        assertThat(index.size()).isEqualTo(3);
    }

    @Test
    void lookups_areCaseSensitiveOnRawValue() {
        CrossReferenceIndex index = CrossReferenceIndex.builder().wallet("0xABC", "person:1").build();

        assertThat(index.personForWallet("0xabc")).isEmpty();
    }

    @Test
    void laterRegistrationWins() {
        CrossReferenceIndex index = CrossReferenceIndex.builder()
                .account("ACC1", "person:first")
                .account("ACC1", "person:second")
                .build();

        assertThat(index.personForAccount("ACC1")).contains("person:second");
    }

    @Test
    void empty_resolvesNothing() {
        CrossReferenceIndex index = CrossReferenceIndex.empty();

        assertThat(index.personForPhone("0811111111")).isEmpty();
        assertThat(index.personForAccount(null)).isEmpty();
        assertThat(index.size()).isZero();
    }
}
