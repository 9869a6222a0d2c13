package com.work.provenance.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 链相关配置（宿主侧）。
 *
 * mode=system: 账本时间取本机时钟
 * mode=web3j: 账本时间取最新区块时间戳
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * system 或 web3j
     */
    private String mode = "system";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    /**
     * EIP-712 签名域中的 chainId
     */
    private long chainId = 31337L;

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }
}
