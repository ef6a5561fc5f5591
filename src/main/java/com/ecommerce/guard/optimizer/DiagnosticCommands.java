package com.ecommerce.guard.optimizer;

import javax.management.JMException;
import javax.management.MBeanOperationInfo;
import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;

/**
 * HotSpot DiagnosticCommand MBean 访问
 * <p>
 * 命令名按 MBean 的驼峰形式传入，例如 {@code System.trim_native_heap} 对应 {@code systemTrimNativeHeap}。
 */
public class DiagnosticCommands {

    static final String OBJECT_NAME = "com.sun.management:type=DiagnosticCommand";

    private final MBeanServer server;

    public DiagnosticCommands() {
        this(ManagementFactory.getPlatformMBeanServer());
    }

    DiagnosticCommands(MBeanServer server) {
        this.server = server;
    }

    public boolean isSupported(String operation) {
        try {
            ObjectName name = new ObjectName(OBJECT_NAME);
            if (!server.isRegistered(name)) {
                return false;
            }
            for (MBeanOperationInfo info : server.getMBeanInfo(name).getOperations()) {
                if (info.getName().equals(operation)) {
                    return true;
                }
            }
            return false;
        } catch (JMException e) {
            return false;
        }
    }

    public String invoke(String operation) throws JMException {
        Object result = server.invoke(new ObjectName(OBJECT_NAME), operation,
            new Object[]{new String[0]}, new String[]{String[].class.getName()});
        return result == null ? "" : result.toString().trim();
    }
}
