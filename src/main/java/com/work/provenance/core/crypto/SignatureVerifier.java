package com.work.provenance.core.crypto;

/**
 * 签名恢复端口：视为可信原语，测试中可替换，也可换成宿主账本自带的实现。
 */
public interface SignatureVerifier {

    /**
     * 从签名中恢复签名者地址（小写 0x 前缀）。
     *
     * @throws com.work.provenance.core.exception.InvalidInputException     签名格式错误
     * @throws com.work.provenance.core.exception.SignatureInvalidException 无法恢复出签名者
     */
    String recoverSigner(TypedDataDomain domain, TypedPayload payload, String signature);
}
