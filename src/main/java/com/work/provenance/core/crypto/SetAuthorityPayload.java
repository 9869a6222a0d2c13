package com.work.provenance.core.crypto;

import static com.work.provenance.core.crypto.Eip712Encoder.address;
import static com.work.provenance.core.crypto.Eip712Encoder.bytes32;
import static com.work.provenance.core.crypto.Eip712Encoder.uint256;

public final class SetAuthorityPayload implements TypedPayload {

    public static final String TYPE =
            "SetAuthority(bytes32 contextId,address authority,uint256 nonce,uint256 deadline)";
    private static final byte[] TYPE_HASH = Eip712Encoder.typeHash(TYPE);

    private final String contextId;
    private final String authority;
    private final long nonce;
    private final long deadline;

    public SetAuthorityPayload(String contextId, String authority, long nonce, long deadline) {
        this.contextId = contextId;
        this.authority = authority;
        this.nonce = nonce;
        this.deadline = deadline;
    }

    @Override
    public String primaryType() {
        return "SetAuthority";
    }

    @Override
    public byte[] hashStruct() {
        return Eip712Encoder.hashStruct(TYPE_HASH,
                bytes32(contextId),
                address(authority),
                uint256(nonce),
                uint256(deadline));
    }
}
