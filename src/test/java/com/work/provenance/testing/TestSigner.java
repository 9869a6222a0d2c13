package com.work.provenance.testing;

import com.work.provenance.core.crypto.TypedDataDomain;
import com.work.provenance.core.crypto.TypedPayload;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * 固定私钥的测试签名者（hardhat 默认账户）。
 */
public final class TestSigner {

    public static final TestSigner ALICE =
            new TestSigner("ac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80");
    public static final TestSigner BOB =
            new TestSigner("59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d");
    public static final TestSigner CAROL =
            new TestSigner("5de4111afa1a4b94908f83103eb1f1706367c2e68ca870fc3fb9a804cdab365a");
    public static final TestSigner DAVE =
            new TestSigner("7c852118294e51e653712a81e05800f419141751be58f605c371e15141b007a6");

    private final ECKeyPair keyPair;
    private final String address;

    public TestSigner(String privateKeyHex) {
        this.keyPair = ECKeyPair.create(new BigInteger(privateKeyHex, 16));
        this.address = Numeric.prependHexPrefix(Keys.getAddress(keyPair.getPublicKey()));
    }

    public String address() {
        return address;
    }

    /**
     * 返回 65 字节 r ‖ s ‖ v 的十六进制签名，v 为 27/28。
     */
    public String sign(TypedDataDomain domain, TypedPayload payload) {
        Sign.SignatureData sig = Sign.signMessage(domain.digest(payload), keyPair, false);
        byte[] out = new byte[65];
        System.arraycopy(sig.getR(), 0, out, 0, 32);
        System.arraycopy(sig.getS(), 0, out, 32, 32);
        out[64] = sig.getV()[0];
        return Numeric.toHexString(out);
    }
}
