package com.fastguard.core.spi.notify;

import com.fastguard.model.NotificationEvent;

public interface NotifierTemplate {
    /** 渲染标题 */
    String renderTitle(NotificationEvent event);

    /** 渲染内容 */
    String renderBody(NotificationEvent event);
}
