package com.work.provenance.server.chain;

import com.work.provenance.core.clock.LedgerClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.response.EthBlock;

import java.io.IOException;

/**
 * 基于 Web3j 的账本时钟：eth_getBlockByNumber(latest) 的区块时间戳。
 * 与链上合约看到的 block.timestamp 口径一致。
 */
public class Web3jLedgerClock implements LedgerClock {

    private static final Logger log = LoggerFactory.getLogger(Web3jLedgerClock.class);

    private final Web3j web3j;

    public Web3jLedgerClock(Web3j web3j) {
        this.web3j = web3j;
    }

    @Override
    public long now() {
        try {
            EthBlock resp = web3j.ethGetBlockByNumber(DefaultBlockParameterName.LATEST, false).send();
            if (resp.hasError() || resp.getBlock() == null) {
                throw new IllegalStateException("读取最新区块失败: "
                        + (resp.hasError() ? resp.getError().getMessage() : "empty block"));
            }
            return resp.getBlock().getTimestamp().longValue();
        } catch (IOException e) {
            log.warn("Web3j getBlockByNumber failed. err={}", e.getMessage());
            throw new IllegalStateException("读取链上时间失败", e);
        }
    }
}
