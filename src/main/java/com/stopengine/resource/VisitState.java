package com.stopengine.resource;

/**
 * 单次解析中资源节点的访问状态。
 */
enum VisitState {
    UNVISITED,
    IN_PROGRESS,
    RESOLVED
}
