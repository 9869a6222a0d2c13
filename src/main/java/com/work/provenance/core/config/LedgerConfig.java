package com.work.provenance.core.config;

import com.work.provenance.core.crypto.TypedDataDomain;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用只需在装配时
 * 将自身读取到的配置参数注入即可，确保 core 包保持与框架解耦。
 */
public class LedgerConfig {

    public static final String DELEGATION_DOMAIN_NAME = "CodeQuillDelegation";
    public static final String WORKSPACE_DOMAIN_NAME = "CodeQuillWorkspaceRegistry";
    public static final String DEFAULT_DOMAIN_VERSION = "1";

    private final TypedDataDomain delegationDomain;
    private final TypedDataDomain workspaceDomain;
    private final int txTimeoutSeconds;

    public LedgerConfig(TypedDataDomain delegationDomain,
                        TypedDataDomain workspaceDomain,
                        int txTimeoutSeconds) {
        if (delegationDomain == null || workspaceDomain == null) {
            throw new IllegalArgumentException("签名域不能为null");
        }
        if (txTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("txTimeoutSeconds 必须大于0");
        }
        this.delegationDomain = delegationDomain;
        this.workspaceDomain = workspaceDomain;
        this.txTimeoutSeconds = txTimeoutSeconds;
    }

    /**
     * 两个签名域的 version 必须与已部署合约的 EIP-712 domain 一致，否则所有签名都会被判为 bad signer。
     */
    public static LedgerConfig of(long chainId,
                                  String delegationContract,
                                  String delegationVersion,
                                  String workspaceContract,
                                  String workspaceVersion,
                                  int txTimeoutSeconds) {
        if (isBlank(delegationVersion) || isBlank(workspaceVersion)) {
            throw new IllegalArgumentException("签名域 version 不能为空");
        }
        return new LedgerConfig(
                new TypedDataDomain(DELEGATION_DOMAIN_NAME, delegationVersion, chainId, delegationContract),
                new TypedDataDomain(WORKSPACE_DOMAIN_NAME, workspaceVersion, chainId, workspaceContract),
                txTimeoutSeconds);
    }

    public static LedgerConfig defaultConfig() {
        return withDomainVersions(DEFAULT_DOMAIN_VERSION, DEFAULT_DOMAIN_VERSION);
    }

    /**
     * 本地链默认合约地址，仅替换签名域 version。
     */
    public static LedgerConfig withDomainVersions(String delegationVersion, String workspaceVersion) {
        return of(31337L,
                "0x5fbdb2315678afecb367f032d93f642f64180aa3", delegationVersion,
                "0xe7f1725e7734ce288f8367e1bb143e90bb3f0512", workspaceVersion,
                10);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    public TypedDataDomain getDelegationDomain() {
        return delegationDomain;
    }

    public TypedDataDomain getWorkspaceDomain() {
        return workspaceDomain;
    }

    public int getTxTimeoutSeconds() {
        return txTimeoutSeconds;
    }
}
