package com.timxs.photopair.service.impl;

import com.timxs.photopair.config.CompositeConfig;
import com.timxs.photopair.model.PhotoPair;
import com.timxs.photopair.model.SourcePhoto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhotoPairerImplTest {

    private PhotoPairerImpl pairer;

    @BeforeEach
    void setUp() {
        pairer = new PhotoPairerImpl(new CompositeConfig());
    }

    @Test
    void derivesFirstNameLastNameFromFilename() {
        assertThat(pairer.deriveDisplayName("Smith_John_01.jpg")).contains("John Smith");
    }

    @Test
    void ignoresTokensAfterTheSecond() {
        assertThat(pairer.deriveDisplayName("Smith_John_Paul_01.jpg")).contains("John Smith");
    }

    @Test
    void splitsOnTheFirstSequenceMarker() {
        assertThat(pairer.deriveDisplayName("Doe_Jane_012.png")).contains("Jane Doe");
        assertThat(pairer.deriveDisplayName("Doe_01_Jane_01.png")).isEmpty();
    }

    @Test
    void nameIsNotDerivableWithoutMarkerOrTwoTokens() {
        assertThat(pairer.deriveDisplayName("Smith_John.jpg")).isEmpty();
        assertThat(pairer.deriveDisplayName("Smith_01.jpg")).isEmpty();
        assertThat(pairer.deriveDisplayName("_John_01.jpg")).isEmpty();
        assertThat(pairer.deriveDisplayName(null)).isEmpty();
    }

    @Test
    void sortsEachSideIndependentlyAndPairsByRank() {
        List<SourcePhoto> left = List.of(photo("b_Bob_01.jpg"), photo("C_Cid_01.jpg"), photo("a_Ann_01.jpg"));
        List<SourcePhoto> right = List.of(photo("zz.jpg"), photo("xx.jpg"), photo("yy.jpg"));

        List<PhotoPair> pairs = pairer.pair(left, right);

        assertThat(pairs).extracting(pair -> pair.left().name())
            .containsExactly("a_Ann_01.jpg", "b_Bob_01.jpg", "C_Cid_01.jpg");
        assertThat(pairs).extracting(pair -> pair.right().name())
            .containsExactly("xx.jpg", "yy.jpg", "zz.jpg");
        assertThat(pairs).extracting(PhotoPair::index).containsExactly(0, 1, 2);
        assertThat(pairs).extracting(PhotoPair::displayName).containsExactly("Ann a", "Bob b", "Cid C");
    }

    @Test
    void truncatesToTheShorterSide() {
        List<SourcePhoto> left = List.of(photo("a_A_01.jpg"), photo("b_B_01.jpg"), photo("c_C_01.jpg"));
        List<SourcePhoto> right = List.of(photo("2.jpg"), photo("1.jpg"));

        List<PhotoPair> pairs = pairer.pair(left, right);

        assertThat(pairs).hasSize(2);
        assertThat(pairs.get(1).left().name()).isEqualTo("b_B_01.jpg");
        assertThat(pairs.get(1).right().name()).isEqualTo("2.jpg");
    }

    @Test
    void fallsBackToFilenameWhenNameIsNotDerivable() {
        List<PhotoPair> pairs = pairer.pair(List.of(photo("portrait.jpg")), List.of(photo("now.jpg")));

        assertThat(pairs).singleElement().satisfies(pair -> {
            assertThat(pair.displayName()).isEqualTo("portrait");
            assertThat(pair.nameDerived()).isFalse();
        });
    }

    @Test
    void concurrentPairingKeepsTheSameOrder() {
        List<SourcePhoto> left = List.of(photo("b_Bob_01.jpg"), photo("C_Cid_01.jpg"), photo("a_Ann_01.jpg"),
            photo("é_Eve_01.jpg"), photo("d_Dan_01.jpg"));
        List<SourcePhoto> right = List.of(photo("5.jpg"), photo("3.jpg"), photo("1.jpg"), photo("4.jpg"),
            photo("2.jpg"));
        List<String> expected = pairer.pair(left, right).stream().map(PhotoPair::displayName).toList();

        List<List<String>> results = Flux.range(0, 64)
            .parallel(8)
            .runOn(Schedulers.parallel())
            .map(i -> pairer.pair(left, right).stream().map(PhotoPair::displayName).toList())
            .sequential()
            .collectList()
            .block();

        assertThat(expected).containsExactly("Ann a", "Bob b", "Cid C", "Dan d", "Eve é");
        assertThat(results).hasSize(64).allSatisfy(names -> assertThat(names).isEqualTo(expected));
    }

    @Test
    void sortLocaleIsReadFromConfiguration() {
        CompositeConfig config = new CompositeConfig();
        config.getBatch().setSortLocale("sv");
        PhotoPairerImpl swedish = new PhotoPairerImpl(config);

        List<PhotoPair> pairs = swedish.pair(List.of(photo("ö_Oli_01.jpg"), photo("z_Zed_01.jpg")),
            List.of(photo("1.jpg"), photo("2.jpg")));

        // 瑞典语中 ö 排在 z 之后
        assertThat(pairs).extracting(PhotoPair::displayName).containsExactly("Zed z", "Oli ö");
    }

    @Test
    void emptySideYieldsNoPairs() {
        assertThat(pairer.pair(List.of(photo("a_A_01.jpg")), List.of())).isEmpty();
    }

    @Test
    void rejectsNullCollections() {
        assertThatThrownBy(() -> pairer.pair(null, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static SourcePhoto photo(String name) {
        return SourcePhoto.of(name, new byte[0]);
    }
}
