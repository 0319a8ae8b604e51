package com.stopengine.error;

import java.util.List;

/**
 * extends 或 alias 形成环，链路按访问顺序记录并以重复节点收尾。
 */
public class ResourceCycleException extends StopwordException {
    private final List<String> chain;

    public ResourceCycleException(List<String> chain) {
        super(ErrorKind.CYCLE, "Circular stopword resource chain: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> getChain() {
        return chain;
    }
}
