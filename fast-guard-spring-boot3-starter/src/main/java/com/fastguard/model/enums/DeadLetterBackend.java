package com.fastguard.model.enums;

/**
 * 死信存储后端
 */
public enum DeadLetterBackend {
    /** 本地追加写文件, 开发环境 */
    LOCAL_FILE,

    /** 数据库表（MyBatis-Plus）, 生产环境 */
    DATABASE
}
