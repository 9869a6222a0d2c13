package com.work.provenance.core.crypto;

import static com.work.provenance.core.crypto.Eip712Encoder.address;
import static com.work.provenance.core.crypto.Eip712Encoder.bytes32;
import static com.work.provenance.core.crypto.Eip712Encoder.uint256;

/**
 * 代签撤销授权的签名载荷，与 {@link DelegatePayload} 共用同一个 nonce 计数器。
 */
public final class RevokePayload implements TypedPayload {

    public static final String TYPE =
            "Revoke(address owner,address relayer,bytes32 contextId,uint256 nonce,uint256 deadline)";
    private static final byte[] TYPE_HASH = Eip712Encoder.typeHash(TYPE);

    private final String owner;
    private final String relayer;
    private final String contextId;
    private final long nonce;
    private final long deadline;

    public RevokePayload(String owner, String relayer, String contextId, long nonce, long deadline) {
        this.owner = owner;
        this.relayer = relayer;
        this.contextId = contextId;
        this.nonce = nonce;
        this.deadline = deadline;
    }

    @Override
    public String primaryType() {
        return "Revoke";
    }

    @Override
    public byte[] hashStruct() {
        return Eip712Encoder.hashStruct(TYPE_HASH,
                address(owner),
                address(relayer),
                bytes32(contextId),
                uint256(nonce),
                uint256(deadline));
    }
}
