package com.e2eq.persistence.util;

import org.jboss.logging.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public class CommonUtils {

    private static final Logger LOG = Logger.getLogger(CommonUtils.class);

    private static final int BUFFER_SIZE = 4096;

    public static void closeStreams(Closeable... streams) {
        if(streams != null) {
            for(Closeable stream : streams) {
                if (stream == null) {
                    continue;
                }
                try {
                    stream.close();
                } catch (IOException e) {
                    LOG.warnf("Failed to close stream: %s", e.getMessage());
                }
            }
        }
    }

    /**
     * Calculates the SHA-256 digest of the given string, UTF-8 encoded.
     *
     * @param input the text to digest
     * @return lower case hex digest, or null when the input is null
     */
    public static String calculateSHA256(String input) {
        if (input == null) {
            return null;
        }
        return calculateSHA256(input.getBytes(StandardCharsets.UTF_8));
    }

    public static String calculateSHA256(byte[] input) {
        if (input == null) {
            return null;
        }
        MessageDigest messageDigest = newSha256();
        return HexFormat.of().formatHex(messageDigest.digest(input));
    }

    /**
     * Streams the content through a SHA-256 digest in 4k chunks. The stream is
     * read to the end but not closed.
     *
     * @param input the content to digest
     * @return lower case hex digest
     * @throws IOException if the stream can not be read
     */
    public static String calculateSHA256(InputStream input) throws IOException {
        MessageDigest messageDigest = newSha256();
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = input.read(buffer)) != -1) {
            messageDigest.update(buffer, 0, read);
        }
        return HexFormat.of().formatHex(messageDigest.digest());
    }

    private static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 calculation failed", e);
        }
    }
}
