package com.fastguard.autoconfig;

import com.fastguard.config.GuardProperties;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.transaction.TransactionAutoConfiguration"
})
@EnableConfigurationProperties(GuardProperties.class)
@ConditionalOnClass({TransactionTemplate.class, PlatformTransactionManager.class})
@ConditionalOnBean(PlatformTransactionManager.class)
public class GuardTxAutoConfiguration {

    /** 业务未定义 TransactionTemplate 时，提供一个默认的编程式事务模板 */
    @Bean
    @ConditionalOnMissingBean(TransactionTemplate.class)
    public TransactionTemplate transactionTemplate(PlatformTransactionManager tm, GuardProperties props) {
        GuardProperties.Tx tx = props.getTx();
        TransactionTemplate tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(tx.getPropagation().value());
        tpl.setIsolationLevel(tx.getIsolation().value());
        tpl.setReadOnly(tx.isReadOnly());
        if (tx.getTimeoutSeconds() > 0) {
            tpl.setTimeout(tx.getTimeoutSeconds());
        }
        return tpl;
    }
}
