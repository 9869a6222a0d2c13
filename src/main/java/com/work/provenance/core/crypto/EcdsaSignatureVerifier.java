package com.work.provenance.core.crypto;

import com.work.provenance.core.exception.InvalidInputException;
import com.work.provenance.core.exception.SignatureInvalidException;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * 基于 web3j 的 secp256k1 ecrecover 实现。
 *
 * 签名格式：65 字节 r ‖ s ‖ v，v 取 27/28（兼容 0/1）。
 * 与链上 ECDSA 库一致，拒绝高位 s 的可延展签名。
 */
public class EcdsaSignatureVerifier implements SignatureVerifier {

    private static final int SIGNATURE_LENGTH = 65;
    private static final BigInteger HALF_CURVE_ORDER =
            new BigInteger("7FFFFFFFFFFFFFFFFFFFFFFFFFFFFFFF5D576E7357A4501DDFE92F46681B20A0", 16);

    @Override
    public String recoverSigner(TypedDataDomain domain, TypedPayload payload, String signature) {
        Sign.SignatureData sig = decode(signature);
        if (Numeric.toBigInt(sig.getS()).compareTo(HALF_CURVE_ORDER) > 0) {
            throw new SignatureInvalidException("bad signer", "签名 s 值不在低半区，拒绝可延展签名");
        }
        byte[] digest = domain.digest(payload);
        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(digest, sig);
            return Numeric.prependHexPrefix(Keys.getAddress(publicKey));
        } catch (SignatureException | RuntimeException e) {
            throw new SignatureInvalidException("bad signer", "无法从签名恢复签名者: " + payload.primaryType(), e);
        }
    }

    static Sign.SignatureData decode(String signature) {
        if (signature == null || signature.trim().isEmpty()) {
            throw new InvalidInputException("bad signature", "signature 不能为空");
        }
        byte[] raw;
        try {
            raw = Numeric.hexStringToByteArray(signature.trim());
        } catch (RuntimeException e) {
            throw new InvalidInputException("bad signature", "signature 不是合法的十六进制", e);
        }
        if (raw.length != SIGNATURE_LENGTH) {
            throw new InvalidInputException("bad signature", "signature 长度必须为65字节，实际为 " + raw.length);
        }
        byte v = raw[64];
        if (v == 0 || v == 1) {
            v = (byte) (v + 27);
        }
        if (v != 27 && v != 28) {
            throw new SignatureInvalidException("bad signer", "signature v 值非法: " + raw[64]);
        }
        return new Sign.SignatureData(v, Arrays.copyOfRange(raw, 0, 32), Arrays.copyOfRange(raw, 32, 64));
    }
}
