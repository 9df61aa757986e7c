package cn.gm.light.pinot.core.selector;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BrokerDto {
    private String host;
    private String instanceName;
    private int port;

    public String extractBrokerName() {
        return host + ":" + port;
    }
}
