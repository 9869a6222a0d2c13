package com.work.provenance.core.crypto;

/**
 * 一种签名载荷。字段顺序与类型串必须与现有签名方逐位一致。
 */
public interface TypedPayload {

    String primaryType();

    byte[] hashStruct();
}
