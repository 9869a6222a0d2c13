package com.work.provenance.core.crypto;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * EIP-712 结构化数据的最小编码器，只覆盖签名载荷用到的静态类型
 * （address / bytes32 / uint256 / bool / string）。
 *
 * digest = keccak256(0x19 0x01 ‖ domainSeparator ‖ hashStruct(message))
 */
public final class Eip712Encoder {

    public static final String DOMAIN_TYPE =
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";

    private static final int WORD = 32;

    private Eip712Encoder() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static byte[] typeHash(String encodedType) {
        return Hash.sha3(encodedType.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] address(String address) {
        return Numeric.toBytesPadded(Numeric.toBigInt(address), WORD);
    }

    public static byte[] bytes32(String hex) {
        byte[] raw = Numeric.hexStringToByteArray(hex);
        if (raw.length != WORD) {
            throw new IllegalArgumentException("bytes32 长度必须为32: " + hex);
        }
        return raw;
    }

    public static byte[] uint256(BigInteger value) {
        return Numeric.toBytesPadded(value, WORD);
    }

    public static byte[] uint256(long value) {
        return uint256(BigInteger.valueOf(value));
    }

    public static byte[] bool(boolean value) {
        return uint256(value ? BigInteger.ONE : BigInteger.ZERO);
    }

    /**
     * 动态类型 string 编码为其内容的 keccak256。
     */
    public static byte[] string(String value) {
        return Hash.sha3(value.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] hashStruct(byte[] typeHash, byte[]... words) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(WORD * (words.length + 1));
        out.writeBytes(typeHash);
        for (byte[] w : words) {
            if (w.length != WORD) {
                throw new IllegalArgumentException("编码字长度必须为32，实际为 " + w.length);
            }
            out.writeBytes(w);
        }
        return Hash.sha3(out.toByteArray());
    }

    public static byte[] digest(byte[] domainSeparator, byte[] structHash) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(2 + WORD * 2);
        out.write(0x19);
        out.write(0x01);
        out.writeBytes(domainSeparator);
        out.writeBytes(structHash);
        return Hash.sha3(out.toByteArray());
    }
}
