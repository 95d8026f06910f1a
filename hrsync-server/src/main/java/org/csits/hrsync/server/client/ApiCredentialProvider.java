package org.csits.hrsync.server.client;

/**
 * 提供 HR 平台调用的 Authorization 请求头。凭据的存储与轮换不在本服务内。
 */
public interface ApiCredentialProvider {

    String authorizationHeader();
}
