package cn.gm.light.pinot.core.selector;

import cn.gm.light.pinot.exception.SelectionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 维护 表 -> broker 列表 的映射，由子类在后台刷新。
 *
 * <p>tableBrokerMap 与 allBrokerList 在写锁下成对替换，读者在读锁下取用，不会看到只更新了一半的状态。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/4 15:12:02
 */
public abstract class TableAwareBrokerSelector implements BrokerSelector {
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();
    private Map<String, List<String>> tableBrokerMap = Collections.emptyMap();
    private List<String> allBrokerList = Collections.emptyList();

    protected void updateBrokerData(Map<String, List<String>> newTableBrokerMap, List<String> newAllBrokerList) {
        Map<String, List<String>> tableMap = new HashMap<>();
        for (Map.Entry<String, List<String>> e : newTableBrokerMap.entrySet()) {
            tableMap.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
        }
        List<String> all = Collections.unmodifiableList(new ArrayList<>(newAllBrokerList));
        rwLock.writeLock().lock();
        try {
            this.tableBrokerMap = Collections.unmodifiableMap(tableMap);
            this.allBrokerList = all;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public String selectBroker(String table) {
        String tableName = TableNames.extractTableName(table);
        List<String> brokerList;
        if (tableName.isEmpty()) {
            brokerList = getAllBrokerList();
            if (brokerList.isEmpty()) {
                throw SelectionException.of("No available broker found");
            }
        } else {
            rwLock.readLock().lock();
            try {
                brokerList = tableBrokerMap.get(tableName);
            } finally {
                rwLock.readLock().unlock();
            }
            if (brokerList == null) {
                throw SelectionException.of("Unable to find the table: " + table);
            }
            if (brokerList.isEmpty()) {
                throw SelectionException.of("No available broker found for table: " + table);
            }
        }
        return brokerList.get(ThreadLocalRandom.current().nextInt(brokerList.size()));
    }

    public Map<String, List<String>> getTableBrokerMap() {
        rwLock.readLock().lock();
        try {
            return tableBrokerMap;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public List<String> getAllBrokerList() {
        rwLock.readLock().lock();
        try {
            return allBrokerList;
        } finally {
            rwLock.readLock().unlock();
        }
    }
}
