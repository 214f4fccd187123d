package com.cuttlefish.backend.service;

import com.cuttlefish.backend.exception.PredictionDecodeException;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Prediction payload codec: three 32-byte big-endian words holding predicted price, confidence in
 * bps and the anomaly flag (0 or 1).
 */
@Component
public class PredictionPayloadDecoder {

    public static final int WORD_SIZE = 32;
    public static final int PAYLOAD_SIZE = 3 * WORD_SIZE;

    public DecodedPrediction decode(byte[] payload) {
        if (payload == null || payload.length != PAYLOAD_SIZE) {
            throw new PredictionDecodeException("Invalid response length: expected " + PAYLOAD_SIZE + " bytes, got "
                    + (payload == null ? 0 : payload.length));
        }
        BigInteger price = word(payload, 0);
        BigInteger confidence = word(payload, 1);
        BigInteger anomaly = word(payload, 2);
        if (anomaly.compareTo(BigInteger.ONE) > 0) {
            throw new PredictionDecodeException("Invalid anomaly flag: " + anomaly);
        }
        return new DecodedPrediction(price, confidence, anomaly.signum() == 1);
    }

    public byte[] parseHex(String hex) {
        if (hex == null) {
            throw new PredictionDecodeException("Payload is required");
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        try {
            return HexFormat.of().parseHex(digits);
        } catch (IllegalArgumentException ex) {
            throw new PredictionDecodeException("Payload is not valid hex: " + ex.getMessage());
        }
    }

    public static byte[] encode(BigInteger predictedPrice, BigInteger confidenceBps, boolean anomaly) {
        byte[] payload = new byte[PAYLOAD_SIZE];
        writeWord(payload, 0, predictedPrice);
        writeWord(payload, 1, confidenceBps);
        writeWord(payload, 2, anomaly ? BigInteger.ONE : BigInteger.ZERO);
        return payload;
    }

    public static String encodeHex(BigInteger predictedPrice, BigInteger confidenceBps, boolean anomaly) {
        return "0x" + HexFormat.of().formatHex(encode(predictedPrice, confidenceBps, anomaly));
    }

    private static BigInteger word(byte[] payload, int index) {
        return new BigInteger(1, Arrays.copyOfRange(payload, index * WORD_SIZE, (index + 1) * WORD_SIZE));
    }

    private static void writeWord(byte[] payload, int index, BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > WORD_SIZE * 8) {
            throw new IllegalArgumentException("Value does not fit an unsigned 256-bit word: " + value);
        }
        byte[] raw = value.toByteArray();
        // toByteArray may carry a leading sign byte
        int start = raw.length > WORD_SIZE ? raw.length - WORD_SIZE : 0;
        int length = raw.length - start;
        System.arraycopy(raw, start, payload, (index + 1) * WORD_SIZE - length, length);
    }

    public record DecodedPrediction(BigInteger predictedPrice, BigInteger confidenceBps, boolean anomaly) {}
}
