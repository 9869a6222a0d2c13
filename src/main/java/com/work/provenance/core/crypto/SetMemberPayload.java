package com.work.provenance.core.crypto;

import static com.work.provenance.core.crypto.Eip712Encoder.address;
import static com.work.provenance.core.crypto.Eip712Encoder.bool;
import static com.work.provenance.core.crypto.Eip712Encoder.bytes32;
import static com.work.provenance.core.crypto.Eip712Encoder.uint256;

public final class SetMemberPayload implements TypedPayload {

    public static final String TYPE =
            "SetMember(bytes32 contextId,address member,bool isMember,uint256 nonce,uint256 deadline)";
    private static final byte[] TYPE_HASH = Eip712Encoder.typeHash(TYPE);

    private final String contextId;
    private final String member;
    private final boolean isMember;
    private final long nonce;
    private final long deadline;

    public SetMemberPayload(String contextId, String member, boolean isMember, long nonce, long deadline) {
        this.contextId = contextId;
        this.member = member;
        this.isMember = isMember;
        this.nonce = nonce;
        this.deadline = deadline;
    }

    @Override
    public String primaryType() {
        return "SetMember";
    }

    @Override
    public byte[] hashStruct() {
        return Eip712Encoder.hashStruct(TYPE_HASH,
                bytes32(contextId),
                address(member),
                bool(isMember),
                uint256(nonce),
                uint256(deadline));
    }
}
