package cn.gm.light.pinot.core.selector;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * external view 节点上的变化通知
 */
@Getter
@ToString
@AllArgsConstructor
public class ExternalViewEvent {

    public enum Type {
        DATA_CHANGED,
        DELETED,
        ERROR
    }

    private final Type type;
    private final Throwable error;

    public static ExternalViewEvent dataChanged() {
        return new ExternalViewEvent(Type.DATA_CHANGED, null);
    }

    public static ExternalViewEvent deleted() {
        return new ExternalViewEvent(Type.DELETED, null);
    }

    public static ExternalViewEvent error(Throwable t) {
        return new ExternalViewEvent(Type.ERROR, t);
    }
}
