package com.chanmux.auth;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Map;

/** Renders pairing payloads as PNG data URLs. */
public class ZxingQrEncoder implements QrEncoder {

    private static final String DATA_URL_PREFIX = "data:image/png;base64,";
    private static final int DEFAULT_SIZE = 300;

    private final int size;

    public ZxingQrEncoder() {
        this(DEFAULT_SIZE);
    }

    public ZxingQrEncoder(int size) {
        this.size = size;
    }

    @Override
    public String encode(String payload) throws QrEncodingException {
        if (payload == null || payload.isEmpty()) {
            throw new QrEncodingException("Pairing payload is empty");
        }
        try {
            var matrix = new QRCodeWriter().encode(payload, BarcodeFormat.QR_CODE, size, size, Map.of(
                    EncodeHintType.ERROR_CORRECTION, ErrorCorrectionLevel.M,
                    EncodeHintType.CHARACTER_SET, "UTF-8",
                    EncodeHintType.MARGIN, 4));
            var out = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(matrix, "PNG", out);
            return DATA_URL_PREFIX + Base64.getEncoder().encodeToString(out.toByteArray());
        } catch (WriterException | IOException e) {
            throw new QrEncodingException("Failed to encode pairing payload", e);
        }
    }
}
