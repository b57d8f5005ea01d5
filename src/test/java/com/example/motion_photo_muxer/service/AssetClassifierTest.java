package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.model.MediaAsset;
import com.example.motion_photo_muxer.util.AssetKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AssetClassifierTest {

    private final AssetClassifier classifier = new AssetClassifier();

    @Test
    void classifiesByExtensionIgnoringCase() {
        assertThat(classifier.classify(Path.of("a/IMG_1.JPG"))).isEqualTo(AssetKind.STILL);
        assertThat(classifier.classify(Path.of("IMG_1.jpeg"))).isEqualTo(AssetKind.STILL);
        assertThat(classifier.classify(Path.of("IMG_1.HeIc"))).isEqualTo(AssetKind.CONVERTIBLE_STILL);
        assertThat(classifier.classify(Path.of("IMG_1.MOV"))).isEqualTo(AssetKind.VIDEO);
        assertThat(classifier.classify(Path.of("IMG_1.mp4"))).isEqualTo(AssetKind.VIDEO);
    }

    @Test
    void unknownOrMissingExtensionIsOther() {
        assertThat(classifier.classify(Path.of("c.png"))).isEqualTo(AssetKind.OTHER);
        assertThat(classifier.classify(Path.of("README"))).isEqualTo(AssetKind.OTHER);
        assertThat(classifier.classify(Path.of(".jpg"))).isEqualTo(AssetKind.OTHER);
        assertThat(classifier.classify(Path.of("clip.mov.bak"))).isEqualTo(AssetKind.OTHER);
    }

    @Test
    void describeDropsOnlyTheLastExtension() {
        MediaAsset asset = classifier.describe(Path.of("dir/holiday.2023.HEIC"));

        assertThat(asset.kind()).isEqualTo(AssetKind.CONVERTIBLE_STILL);
        assertThat(asset.stem()).isEqualTo("holiday.2023");
        assertThat(asset.hasStem("HOLIDAY.2023")).isTrue();
    }
}
