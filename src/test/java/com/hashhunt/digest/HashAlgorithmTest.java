package com.hashhunt.digest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HashAlgorithm")
class HashAlgorithmTest {

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @ParameterizedTest(name = "\"{0}\" -> {1}")
        @CsvSource({
            "MD5,     MD5",
            "md5,     MD5",
            "SHA-1,   SHA1",
            "sha1,    SHA1",
            "SHA-256, SHA256",
            "' sha256 ', SHA256"
        })
        @DisplayName("accepts known names case-insensitively")
        void knownNames(String name, HashAlgorithm expected) {
            assertEquals(expected, HashAlgorithm.fromName(name));
        }

        @ParameterizedTest
        @ValueSource(strings = {"SHA-512", "CRC32", "", "bcrypt"})
        @DisplayName("rejects anything else")
        void unsupported(String name) {
            UnsupportedAlgorithmException e = assertThrows(UnsupportedAlgorithmException.class,
                () -> HashAlgorithm.fromName(name));
            assertEquals(name, e.getAlgorithmName());
        }
    }

    @Nested
    @DisplayName("Digests")
    class DigestTests {

        @ParameterizedTest(name = "{0}(\"{1}\")")
        @CsvSource({
            "MD5,    10,  d3d9446802a44259755d38e6d163e820",
            "MD5,    abc, 900150983cd24fb0d6963f7d28e17f72",
            "SHA1,   abc, a9993e364706816aba3e25717850c26c9cd0d89d",
            "SHA256, abc, ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
            "SHA256, 1234, 03ac674216f3e15c761ee1a5e255f067953623c8b388b4459e13f978d7c846f4"
        })
        @DisplayName("match known vectors as lower-case hex")
        void knownVectors(HashAlgorithm algorithm, String input, String expected) {
            assertEquals(expected, algorithm.digest(input));
            assertEquals(algorithm.getHexLength(), expected.length());
        }

        @Test
        @DisplayName("a reused digest function gives the same result every time")
        void reusedFunction() {
            DigestFunction md5 = HashAlgorithm.MD5.newInstance();

            assertEquals("d41d8cd98f00b204e9800998ecf8427e", md5.digest(""));
            assertEquals("d3d9446802a44259755d38e6d163e820", md5.digest("10"));
            assertEquals("d41d8cd98f00b204e9800998ecf8427e", md5.digest(""));
        }

        @Test
        @DisplayName("hex encoding keeps leading zeros")
        void hexLeadingZeros() {
            assertEquals("000fff10", HashAlgorithm.toHex(new byte[] {0x00, 0x0f, (byte) 0xff, 0x10}));
        }
    }
}
