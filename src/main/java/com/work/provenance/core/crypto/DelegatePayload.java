package com.work.provenance.core.crypto;

import java.math.BigInteger;

import static com.work.provenance.core.crypto.Eip712Encoder.address;
import static com.work.provenance.core.crypto.Eip712Encoder.bytes32;
import static com.work.provenance.core.crypto.Eip712Encoder.uint256;

/**
 * 注册授权的签名载荷。
 */
public final class DelegatePayload implements TypedPayload {

    public static final String TYPE =
            "Delegate(address owner,address relayer,bytes32 contextId,uint256 scopes,uint256 nonce,uint256 expiry,uint256 deadline)";
    private static final byte[] TYPE_HASH = Eip712Encoder.typeHash(TYPE);

    private final String owner;
    private final String relayer;
    private final String contextId;
    private final BigInteger scopes;
    private final long nonce;
    private final long expiry;
    private final long deadline;

    public DelegatePayload(String owner, String relayer, String contextId, BigInteger scopes,
                           long nonce, long expiry, long deadline) {
        this.owner = owner;
        this.relayer = relayer;
        this.contextId = contextId;
        this.scopes = scopes;
        this.nonce = nonce;
        this.expiry = expiry;
        this.deadline = deadline;
    }

    @Override
    public String primaryType() {
        return "Delegate";
    }

    @Override
    public byte[] hashStruct() {
        return Eip712Encoder.hashStruct(TYPE_HASH,
                address(owner),
                address(relayer),
                bytes32(contextId),
                uint256(scopes),
                uint256(nonce),
                uint256(expiry),
                uint256(deadline));
    }
}
