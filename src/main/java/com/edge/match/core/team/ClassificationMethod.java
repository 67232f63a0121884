package com.edge.match.core.team;

public enum ClassificationMethod {
    /** 无参考色的纯聚类 */
    COLOR_CLUSTERING,
    /** 聚类后按用户提供的队色对齐 */
    USER_HINT,
    /** 人工指定 */
    MANUAL
}
