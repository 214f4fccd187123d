package com.cuttlefish.backend.service;

import com.cuttlefish.backend.exception.PredictionDecodeException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PredictionPayloadDecoderTest {

    private final PredictionPayloadDecoder decoder = new PredictionPayloadDecoder();

    @Test
    void decodesThreeBigEndianWords() {
        byte[] payload = new byte[96];
        payload[31] = 0x64;
        payload[62] = 0x23;
        payload[63] = 0x28;
        payload[95] = 1;

        PredictionPayloadDecoder.DecodedPrediction decoded = decoder.decode(payload);

        assertThat(decoded.predictedPrice()).isEqualTo(BigInteger.valueOf(100));
        assertThat(decoded.confidenceBps()).isEqualTo(BigInteger.valueOf(9000));
        assertThat(decoded.anomaly()).isTrue();
    }

    @Test
    void wrongLengthIsRejected() {
        assertThatThrownBy(() -> decoder.decode(new byte[64]))
                .isInstanceOf(PredictionDecodeException.class)
                .hasMessage("Invalid response length: expected 96 bytes, got 64");
        assertThatThrownBy(() -> decoder.decode(new byte[97]))
                .isInstanceOf(PredictionDecodeException.class);
    }

    @Test
    void anomalyWordMustBeBoolean() {
        byte[] payload = new byte[96];
        payload[95] = 2;

        assertThatThrownBy(() -> decoder.decode(payload))
                .isInstanceOf(PredictionDecodeException.class)
                .hasMessageContaining("anomaly");
    }

    @Test
    void hexWithOrWithoutPrefixParses() {
        String hex = PredictionPayloadDecoder.encodeHex(BigInteger.valueOf(2600), BigInteger.valueOf(8500), false);

        assertThat(decoder.parseHex(hex)).hasSize(96);
        assertThat(decoder.decode(decoder.parseHex(hex.substring(2))).confidenceBps()).isEqualTo(BigInteger.valueOf(8500));
        assertThatThrownBy(() -> decoder.parseHex("0xzz")).isInstanceOf(PredictionDecodeException.class);
        assertThatThrownBy(() -> decoder.parseHex(null)).hasMessage("Payload is required");
    }

    @Test
    void fullWidthWordsSurvive() {
        BigInteger max = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

        PredictionPayloadDecoder.DecodedPrediction decoded =
                decoder.decode(PredictionPayloadDecoder.encode(max, BigInteger.ZERO, false));

        assertThat(decoded.predictedPrice()).isEqualTo(max);
        assertThat(decoded.anomaly()).isFalse();
    }
}
