package com.blockflow.pygen.gen;

/** Import lines emitted into the preamble by the built-in generators. */
public final class PyImports {
    public static final String PANDAS = "import pandas as pd";
    public static final String NUMPY = "import numpy as np";
    public static final String SEABORN = "import seaborn as sns";
    public static final String PYPLOT = "import matplotlib.pyplot as plt";
    public static final String FOLIUM = "import folium";

    public static final String TRAIN_TEST_SPLIT = "from sklearn.model_selection import train_test_split";
    public static final String LINEAR_REGRESSION = "from sklearn.linear_model import LinearRegression";
    public static final String LOGISTIC_REGRESSION = "from sklearn.linear_model import LogisticRegression";
    public static final String KNN = "from sklearn.neighbors import KNeighborsClassifier";
    public static final String NAIVE_BAYES = "from sklearn.naive_bayes import MultinomialNB";
    public static final String DECISION_TREE = "from sklearn.tree import DecisionTreeClassifier, export_graphviz";
    public static final String GRAPHVIZ = "from graphviz import Source";
    public static final String KMEANS = "from sklearn.cluster import KMeans";
    public static final String TENSORFLOW = "import tensorflow";
    public static final String KERAS = "from tensorflow import keras";

    public static final String ACCURACY_SCORE = "from sklearn.metrics import accuracy_score";
    public static final String CONFUSION_MATRIX = "from sklearn.metrics import confusion_matrix";
    public static final String CLASSIFICATION_REPORT = "from sklearn.metrics import classification_report";
    public static final String METRICS = "from sklearn import metrics";

    private PyImports() {
    }
}
