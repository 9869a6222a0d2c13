package com.work.provenance.core.crypto;

import java.util.Arrays;

/**
 * EIP-712 签名域。不同注册表各自拥有独立的域，签名不能跨注册表复用。
 */
public final class TypedDataDomain {

    private static final byte[] DOMAIN_TYPE_HASH = Eip712Encoder.typeHash(Eip712Encoder.DOMAIN_TYPE);

    private final String name;
    private final String version;
    private final long chainId;
    private final String verifyingContract;
    private final byte[] separator;

    public TypedDataDomain(String name, String version, long chainId, String verifyingContract) {
        if (name == null || version == null || verifyingContract == null) {
            throw new IllegalArgumentException("name/version/verifyingContract 不能为null");
        }
        this.name = name;
        this.version = version;
        this.chainId = chainId;
        this.verifyingContract = verifyingContract;
        this.separator = Eip712Encoder.hashStruct(DOMAIN_TYPE_HASH,
                Eip712Encoder.string(name),
                Eip712Encoder.string(version),
                Eip712Encoder.uint256(chainId),
                Eip712Encoder.address(verifyingContract));
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public long getChainId() {
        return chainId;
    }

    public String getVerifyingContract() {
        return verifyingContract;
    }

    public byte[] separator() {
        return Arrays.copyOf(separator, separator.length);
    }

    public byte[] digest(TypedPayload payload) {
        return Eip712Encoder.digest(separator, payload.hashStruct());
    }

    @Override
    public String toString() {
        return "TypedDataDomain{" + name + " v" + version + ", chainId=" + chainId + ", " + verifyingContract + '}';
    }
}
