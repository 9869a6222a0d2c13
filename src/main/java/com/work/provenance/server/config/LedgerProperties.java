package com.work.provenance.server.config;

import com.work.provenance.core.config.LedgerConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 仅存在于宿主包，用于从 application.yml 读取配置。
 * 再由配置类转换为 core 包所需的 {@link com.work.provenance.core.config.LedgerConfig}。
 */
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * memory 或 postgres
     */
    private String store = "postgres";

    /**
     * 委托签名域的 verifyingContract
     */
    private String delegationContract = "0x5fbdb2315678afecb367f032d93f642f64180aa3";

    /**
     * 委托签名域的 version，须与合约部署时的 EIP712 version 一致
     */
    private String delegationDomainVersion = LedgerConfig.DEFAULT_DOMAIN_VERSION;

    /**
     * workspace 签名域的 verifyingContract
     */
    private String workspaceContract = "0xe7f1725e7734ce288f8367e1bb143e90bb3f0512";

    /**
     * workspace 签名域的 version
     */
    private String workspaceDomainVersion = LedgerConfig.DEFAULT_DOMAIN_VERSION;

    /**
     * 单个账本步骤的事务超时（仅 postgres 存储生效）
     */
    private Duration txTimeout = Duration.ofSeconds(10);

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public String getDelegationContract() {
        return delegationContract;
    }

    public void setDelegationContract(String delegationContract) {
        this.delegationContract = delegationContract;
    }

    public String getWorkspaceContract() {
        return workspaceContract;
    }

    public void setWorkspaceContract(String workspaceContract) {
        this.workspaceContract = workspaceContract;
    }

    public String getDelegationDomainVersion() {
        return delegationDomainVersion;
    }

    public void setDelegationDomainVersion(String delegationDomainVersion) {
        this.delegationDomainVersion = delegationDomainVersion;
    }

    public String getWorkspaceDomainVersion() {
        return workspaceDomainVersion;
    }

    public void setWorkspaceDomainVersion(String workspaceDomainVersion) {
        this.workspaceDomainVersion = workspaceDomainVersion;
    }

    public Duration getTxTimeout() {
        return txTimeout;
    }

    public void setTxTimeout(Duration txTimeout) {
        this.txTimeout = txTimeout;
    }
}
